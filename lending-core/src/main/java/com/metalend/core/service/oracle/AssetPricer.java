package com.metalend.core.service.oracle;

import com.metalend.core.model.AssetRef;

import java.math.BigDecimal;

/**
 * Read path for collateral valuation. Implementations must return a strictly positive price or throw.
 */
@FunctionalInterface
public interface AssetPricer {

    BigDecimal priceOf(AssetRef asset);
}
