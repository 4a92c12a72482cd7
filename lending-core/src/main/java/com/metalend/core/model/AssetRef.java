package com.metalend.core.model;

import com.metalend.core.exception.ErrorCode;
import com.metalend.core.exception.ValidationException;

/**
 * Identifies one unique asset: the class (collection) it belongs to and its id within that class.
 */
public record AssetRef(String assetClass, String assetId) {

    public AssetRef {
        if (assetClass == null || assetClass.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_ASSET, "Asset class is required");
        }
        if (assetId == null || assetId.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_ASSET, "Asset id is required");
        }
    }

    public static AssetRef of(String assetClass, String assetId) {
        return new AssetRef(assetClass, assetId);
    }

    @Override
    public String toString() {
        return assetClass + "#" + assetId;
    }
}
