package com.metalend.core.service.oracle;

import com.metalend.core.config.LendingProperties;
import com.metalend.core.event.LendingEvent;
import com.metalend.core.event.LendingEventType;
import com.metalend.core.exception.ErrorCode;
import com.metalend.core.exception.PreconditionException;
import com.metalend.core.exception.ValidationException;
import com.metalend.core.model.AssetRef;
import com.metalend.core.model.SpotPrice;
import com.metalend.core.port.AuthorizationPort;
import com.metalend.core.port.Role;
import com.metalend.core.support.OperationScope;
import com.metalend.core.support.OperationTemplate;
import com.metalend.core.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-asset spot prices with a per-class floor fallback.
 * <p>
 * A spot price is served while it is younger than the validity window; after that the class floor is
 * returned. Spot updates are capped by a relative deviation from the last reported spot whatever its age, floors
 * are administrative re-anchors and are not capped. Writes need {@link Role#PRICE_UPDATER}, so the updater
 * set can be swapped for another reporter mechanism without touching {@link #priceOf(AssetRef)}.
 */
@Slf4j
@Service
public class ValuationOracle implements AssetPricer {

    private final AuthorizationPort authorization;
    private final OperationTemplate operations;
    private final Clock clock;
    private final Duration spotValidity;
    private final BigDecimal maxDeviation;

    private final Set<String> supportedClasses = new HashSet<>();
    private final Map<String, BigDecimal> floorPrices = new HashMap<>();
    private final Map<AssetRef, SpotPrice> spotPrices = new HashMap<>();
    private BigDecimal referenceRate;

    public ValuationOracle(LendingProperties properties, AuthorizationPort authorization,
                           OperationTemplate operations, Clock clock) {
        LendingProperties.Oracle cfg = properties.getOracle();
        this.authorization = authorization;
        this.operations = operations;
        this.clock = clock;
        this.spotValidity = cfg.getSpotValidity();
        this.maxDeviation = cfg.getMaxDeviation();
        this.referenceRate = cfg.getReferenceRate();
        this.supportedClasses.addAll(cfg.getSupportedAssetClasses());
    }

    public void setAssetClassSupport(String caller, String assetClass, boolean supported) {
        operations.run("oracle.setAssetClassSupport", scope -> {
            authorization.require(caller, Role.ADMIN);
            requireClassName(assetClass);
            boolean changed = supported ? supportedClasses.add(assetClass) : supportedClasses.remove(assetClass);
            if (changed) {
                scope.onRollback(() -> {
                    if (supported) {
                        supportedClasses.remove(assetClass);
                    } else {
                        supportedClasses.add(assetClass);
                    }
                });
            }
            scope.publish(LendingEvent.of(LendingEventType.ASSET_CLASS_SUPPORT_CHANGED, assetClass, caller, clock.instant(),
                    Map.of("supported", supported ? BigDecimal.ONE : BigDecimal.ZERO)));
            log.info("Asset class support changed class={} supported={}", assetClass, supported);
        });
    }

    public boolean isSupported(String assetClass) {
        return assetClass != null && supportedClasses.contains(assetClass);
    }

    public void setFloorPrice(String caller, String assetClass, BigDecimal price) {
        operations.run("oracle.setFloorPrice", scope -> {
            authorization.require(caller, Role.PRICE_UPDATER);
            requireSupported(assetClass);
            requirePositive(price, "Invalid floor price");
            BigDecimal scaled = MoneyUtils.scale(price);
            BigDecimal previous = floorPrices.put(assetClass, scaled);
            scope.onRollback(() -> restore(floorPrices, assetClass, previous));
            scope.publish(LendingEvent.of(LendingEventType.FLOOR_PRICE_UPDATED, assetClass, caller, clock.instant(),
                    Map.of("price", scaled)));
            log.info("Floor price updated class={} price={}", assetClass, scaled);
        });
    }

    public void setSpotPrice(String caller, String assetClass, String assetId, BigDecimal price) {
        operations.run("oracle.setSpotPrice", scope -> {
            authorization.require(caller, Role.PRICE_UPDATER);
            requireSupported(assetClass);
            applySpot(scope, caller, AssetRef.of(assetClass, assetId), price);
        });
    }

    /**
     * Applies every price or none. Ids repeated within the batch are deviation-checked against the
     * value staged earlier in the same batch.
     */
    public void batchUpdatePrices(String caller, String assetClass, List<String> assetIds, List<BigDecimal> prices) {
        operations.run("oracle.batchUpdatePrices", scope -> {
            authorization.require(caller, Role.PRICE_UPDATER);
            if (assetIds == null || prices == null || assetIds.size() != prices.size()) {
                throw new ValidationException(ErrorCode.BATCH_LENGTH_MISMATCH, "Array length mismatch");
            }
            requireSupported(assetClass);
            for (int i = 0; i < assetIds.size(); i++) {
                applySpot(scope, caller, AssetRef.of(assetClass, assetIds.get(i)), prices.get(i));
            }
            log.info("Batch price update class={} count={}", assetClass, assetIds.size());
        });
    }

    public BigDecimal getPrice(String assetClass, String assetId) {
        requireSupported(assetClass);
        AssetRef asset = AssetRef.of(assetClass, assetId);
        Optional<BigDecimal> spot = validSpot(asset, clock.instant());
        if (spot.isPresent()) {
            return spot.get();
        }
        BigDecimal floor = floorPrices.get(assetClass);
        if (floor == null) {
            throw new PreconditionException(ErrorCode.PRICE_UNAVAILABLE, "No valid price for " + asset);
        }
        return floor;
    }

    @Override
    public BigDecimal priceOf(AssetRef asset) {
        return getPrice(asset.assetClass(), asset.assetId());
    }

    public Optional<BigDecimal> getFloorPrice(String assetClass) {
        return Optional.ofNullable(floorPrices.get(assetClass));
    }

    public boolean isPriceValid(String assetClass, String assetId) {
        return validSpot(AssetRef.of(assetClass, assetId), clock.instant()).isPresent();
    }

    public void setReferenceRate(String caller, BigDecimal rate) {
        operations.run("oracle.setReferenceRate", scope -> {
            authorization.require(caller, Role.PRICE_UPDATER);
            requirePositive(rate, "Invalid reference rate");
            BigDecimal previous = referenceRate;
            referenceRate = rate;
            scope.onRollback(() -> referenceRate = previous);
            scope.publish(LendingEvent.of(LendingEventType.REFERENCE_RATE_UPDATED, "reference", caller, clock.instant(),
                    Map.of("rate", rate)));
        });
    }

    public BigDecimal getReferenceRate() {
        return referenceRate;
    }

    /** Price converted into the reference currency. */
    public BigDecimal getPriceInReference(String assetClass, String assetId) {
        return MoneyUtils.applyRatio(getPrice(assetClass, assetId), referenceRate);
    }

    public Duration getSpotValidity() {
        return spotValidity;
    }

    public BigDecimal getMaxDeviation() {
        return maxDeviation;
    }

    private void applySpot(OperationScope scope, String caller, AssetRef asset, BigDecimal price) {
        requirePositive(price, "Invalid price");
        BigDecimal scaled = MoneyUtils.scale(price);
        Instant now = clock.instant();
        SpotPrice last = spotPrices.get(asset);
        if (last != null && exceedsDeviation(last.price(), scaled)) {
            throw new PreconditionException(ErrorCode.DEVIATION_EXCEEDED,
                    "Price deviation too high for " + asset + ": " + last.price() + " -> " + scaled);
        }
        SpotPrice previous = spotPrices.put(asset, new SpotPrice(scaled, now));
        scope.onRollback(() -> restore(spotPrices, asset, previous));
        scope.publish(LendingEvent.of(LendingEventType.SPOT_PRICE_UPDATED, asset, caller, now, Map.of("price", scaled)));
        log.debug("Spot price updated asset={} price={}", asset, scaled);
    }

    private boolean exceedsDeviation(BigDecimal previous, BigDecimal next) {
        BigDecimal move = next.subtract(previous).abs();
        return move.compareTo(previous.multiply(maxDeviation)) > 0;
    }

    private Optional<BigDecimal> validSpot(AssetRef asset, Instant now) {
        SpotPrice spot = spotPrices.get(asset);
        if (spot == null || !spot.isValidAt(now, spotValidity)) {
            return Optional.empty();
        }
        return Optional.of(spot.price());
    }

    private void requireSupported(String assetClass) {
        if (!isSupported(assetClass)) {
            throw new ValidationException(ErrorCode.UNSUPPORTED_ASSET_CLASS, "Collection not supported: " + assetClass);
        }
    }

    private static void requireClassName(String assetClass) {
        if (assetClass == null || assetClass.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_ASSET, "Asset class is required");
        }
    }

    private static void requirePositive(BigDecimal value, String message) {
        if (!MoneyUtils.isPositive(value) || MoneyUtils.scale(value).signum() == 0) {
            throw new ValidationException(ErrorCode.INVALID_PRICE, message);
        }
    }

    private static <K, V> void restore(Map<K, V> map, K key, V previous) {
        if (previous == null) {
            map.remove(key);
        } else {
            map.put(key, previous);
        }
    }
}
