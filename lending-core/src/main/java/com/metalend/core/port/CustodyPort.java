package com.metalend.core.port;

import com.metalend.core.model.AssetRef;

/**
 * Atomic custody transfer primitive. Each call either fully moves the asset or throws with no effect.
 */
public interface CustodyPort {

    void takeIntoCustody(String from, AssetRef asset);

    void releaseFromCustody(AssetRef asset, String to);
}
