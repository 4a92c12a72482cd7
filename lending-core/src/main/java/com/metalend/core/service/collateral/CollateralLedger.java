package com.metalend.core.service.collateral;

import com.metalend.core.config.LendingProperties;
import com.metalend.core.event.LendingEvent;
import com.metalend.core.event.LendingEventType;
import com.metalend.core.exception.ErrorCode;
import com.metalend.core.exception.PreconditionException;
import com.metalend.core.exception.ValidationException;
import com.metalend.core.model.AssetRef;
import com.metalend.core.model.CollateralPosition;
import com.metalend.core.model.PositionStatus;
import com.metalend.core.port.AuthorizationPort;
import com.metalend.core.port.CustodyPort;
import com.metalend.core.port.Role;
import com.metalend.core.service.oracle.AssetPricer;
import com.metalend.core.support.OperationScope;
import com.metalend.core.support.OperationTemplate;
import com.metalend.core.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns pledged assets: the position arena, the active-position index per asset and custody.
 * <p>
 * Bookkeeping is always updated before custody moves. Encumbrance (the loan a position backs) is
 * written only by the lending pool, force-close only by the liquidation engine.
 */
@Slf4j
@Service
public class CollateralLedger {

    private final AssetPricer pricer;
    private final CustodyPort custody;
    private final AuthorizationPort authorization;
    private final OperationTemplate operations;
    private final Clock clock;

    private final Map<Long, CollateralPosition> positions = new LinkedHashMap<>();
    private final Map<AssetRef, Long> activeByAsset = new HashMap<>();
    private final Map<String, List<Long>> positionsByOwner = new HashMap<>();
    private long nextPositionId = 1L;
    private BigDecimal loanToValueMax;

    public CollateralLedger(LendingProperties properties, AssetPricer pricer, CustodyPort custody,
                            AuthorizationPort authorization, OperationTemplate operations, Clock clock) {
        this.pricer = pricer;
        this.custody = custody;
        this.authorization = authorization;
        this.operations = operations;
        this.clock = clock;
        this.loanToValueMax = properties.getCollateral().getLoanToValueMax();
    }

    public long deposit(String party, AssetRef asset, BigDecimal loanAmountRequested) {
        return operations.execute("collateral.deposit", scope -> {
            if (!MoneyUtils.isPositive(loanAmountRequested)) {
                throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Invalid loan amount");
            }
            if (activeByAsset.containsKey(asset)) {
                throw new PreconditionException(ErrorCode.ALREADY_PLEDGED, "Asset already used as collateral: " + asset);
            }
            BigDecimal value = pricer.priceOf(asset);
            if (loanAmountRequested.compareTo(value.multiply(loanToValueMax)) > 0) {
                throw new PreconditionException(ErrorCode.EXCEEDS_LOAN_TO_VALUE,
                        "Loan amount " + loanAmountRequested + " exceeds " + loanToValueMax + " of value " + value);
            }
            Instant now = clock.instant();
            long positionId = nextPositionId++;
            CollateralPosition position = CollateralPosition.builder()
                    .id(positionId)
                    .asset(asset)
                    .owner(party)
                    .valueAtDeposit(value)
                    .loanToValueBound(loanToValueMax)
                    .status(PositionStatus.ACTIVE)
                    .depositedAt(now)
                    .markedValue(value)
                    .markedAt(now)
                    .build();
            save(scope, position);
            activeByAsset.put(asset, positionId);
            scope.onRollback(() -> activeByAsset.remove(asset));
            List<Long> owned = positionsByOwner.computeIfAbsent(party, key -> new ArrayList<>());
            owned.add(positionId);
            scope.onRollback(() -> owned.remove(Long.valueOf(positionId)));

            custody.takeIntoCustody(party, asset);
            scope.onRollback(() -> custody.releaseFromCustody(asset, party));

            scope.publish(LendingEvent.of(LendingEventType.COLLATERAL_DEPOSITED, positionId, party, now,
                    Map.of("value", value, "requested", loanAmountRequested)));
            log.info("Collateral deposited positionId={} asset={} owner={} value={}", positionId, asset, party, value);
            return positionId;
        });
    }

    public void withdraw(String party, long positionId) {
        operations.run("collateral.withdraw", scope -> {
            CollateralPosition position = require(positionId);
            if (!position.getOwner().equals(party)) {
                throw new PreconditionException(ErrorCode.NOT_OWNER, "Not the position owner");
            }
            if (position.isEncumbered()) {
                throw new PreconditionException(ErrorCode.POSITION_ENCUMBERED,
                        "Position " + positionId + " backs active loan " + position.getLinkedLoanId());
            }
            if (!isHealthy(positionId)) {
                throw new PreconditionException(ErrorCode.POSITION_NOT_ACTIVE, "Position " + positionId + " is not active");
            }
            close(scope, position, PositionStatus.WITHDRAWN, party);
            scope.publish(LendingEvent.of(LendingEventType.COLLATERAL_WITHDRAWN, positionId, party, clock.instant()));
            log.info("Collateral withdrawn positionId={} asset={} owner={}", positionId, position.getAsset(), party);
        });
    }

    /**
     * Liquidation-only exit: deactivates the position and hands custody to {@code recipient}.
     */
    public void forceClose(String caller, long positionId, String recipient) {
        operations.run("collateral.forceClose", scope -> {
            authorization.require(caller, Role.LIQUIDATION_ENGINE);
            CollateralPosition position = require(positionId);
            if (!position.isActive()) {
                throw new PreconditionException(ErrorCode.POSITION_NOT_ACTIVE, "Position " + positionId + " is not active");
            }
            close(scope, position.toBuilder().linkedLoanId(null).build(), PositionStatus.LIQUIDATED, recipient);
            scope.publish(LendingEvent.of(LendingEventType.COLLATERAL_FORCE_CLOSED, positionId, recipient, clock.instant()));
            log.warn("Collateral force-closed positionId={} asset={} recipient={}", positionId, position.getAsset(), recipient);
        });
    }

    public void encumber(String caller, long positionId, long loanId) {
        operations.run("collateral.encumber", scope -> {
            authorization.require(caller, Role.LENDING_POOL);
            CollateralPosition position = require(positionId);
            if (!position.isActive()) {
                throw new PreconditionException(ErrorCode.POSITION_NOT_ACTIVE, "Collateral not active");
            }
            if (position.isEncumbered()) {
                throw new PreconditionException(ErrorCode.POSITION_ENCUMBERED,
                        "Position " + positionId + " already backs loan " + position.getLinkedLoanId());
            }
            save(scope, position.toBuilder().linkedLoanId(loanId).build());
            scope.publish(LendingEvent.of(LendingEventType.COLLATERAL_ENCUMBERED, positionId, position.getOwner(),
                    clock.instant(), Map.of("loanId", BigDecimal.valueOf(loanId))));
        });
    }

    public void release(String caller, long positionId, long loanId) {
        operations.run("collateral.release", scope -> {
            authorization.require(caller, Role.LENDING_POOL);
            CollateralPosition position = require(positionId);
            if (position.getLinkedLoanId() == null || position.getLinkedLoanId() != loanId) {
                throw new PreconditionException(ErrorCode.POSITION_ENCUMBERED,
                        "Position " + positionId + " is not linked to loan " + loanId);
            }
            save(scope, position.toBuilder().linkedLoanId(null).build());
            scope.publish(LendingEvent.of(LendingEventType.COLLATERAL_RELEASED, positionId, position.getOwner(),
                    clock.instant(), Map.of("loanId", BigDecimal.valueOf(loanId))));
        });
    }

    /**
     * Re-marks every listed position from the pricer. One unknown or inactive position fails the batch.
     */
    public void batchUpdateValuations(String caller, List<Long> positionIds) {
        operations.run("collateral.batchUpdateValuations", scope -> {
            authorization.require(caller, Role.PRICE_UPDATER);
            if (positionIds == null || positionIds.isEmpty()) {
                throw new ValidationException(ErrorCode.BATCH_LENGTH_MISMATCH, "Empty valuation batch");
            }
            Instant now = clock.instant();
            for (Long positionId : positionIds) {
                CollateralPosition position = require(positionId);
                if (!position.isActive()) {
                    throw new PreconditionException(ErrorCode.POSITION_NOT_ACTIVE, "Position " + positionId + " is not active");
                }
                BigDecimal value = pricer.priceOf(position.getAsset());
                save(scope, position.toBuilder().markedValue(value).markedAt(now).build());
                scope.publish(LendingEvent.of(LendingEventType.COLLATERAL_REVALUED, positionId, caller, now,
                        Map.of("previous", position.getMarkedValue(), "value", value)));
            }
            log.info("Batch valuation update count={}", positionIds.size());
        });
    }

    /** True iff the position is active; debt-aware health lives in the liquidation controller. */
    public boolean isHealthy(long positionId) {
        return require(positionId).isActive();
    }

    public BigDecimal valueOf(long positionId) {
        return pricer.priceOf(require(positionId).getAsset());
    }

    public CollateralPosition getPosition(long positionId) {
        return require(positionId);
    }

    public List<CollateralPosition> positionsOf(String owner) {
        return positionsByOwner.getOrDefault(owner, List.of()).stream()
                .map(positions::get)
                .toList();
    }

    public Optional<CollateralPosition> activePositionFor(AssetRef asset) {
        return Optional.ofNullable(activeByAsset.get(asset)).map(positions::get);
    }

    public long activeCount() {
        return activeByAsset.size();
    }

    public BigDecimal getLoanToValueMax() {
        return loanToValueMax;
    }

    public void setLoanToValueMax(String caller, BigDecimal ltv) {
        operations.run("collateral.setLoanToValueMax", scope -> {
            authorization.require(caller, Role.ADMIN);
            if (ltv == null || ltv.signum() <= 0 || ltv.compareTo(BigDecimal.ONE) > 0) {
                throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Loan-to-value bound must be in (0, 1]");
            }
            BigDecimal previous = loanToValueMax;
            loanToValueMax = ltv;
            scope.onRollback(() -> loanToValueMax = previous);
            scope.publish(LendingEvent.of(LendingEventType.LOAN_TO_VALUE_UPDATED, "ltv", caller, clock.instant(),
                    Map.of("previous", previous, "ltv", ltv)));
            log.info("Loan-to-value bound updated {} -> {}", previous, ltv);
        });
    }

    private void close(OperationScope scope, CollateralPosition position, PositionStatus target, String recipient) {
        if (!position.getStatus().canTransitionTo(target)) {
            throw new IllegalStateException("Invalid position transition: " + position.getStatus() + " -> " + target);
        }
        AssetRef asset = position.getAsset();
        save(scope, position.toBuilder().status(target).closedAt(clock.instant()).build());
        Long indexed = activeByAsset.remove(asset);
        scope.onRollback(() -> activeByAsset.put(asset, indexed));

        custody.releaseFromCustody(asset, recipient);
        scope.onRollback(() -> custody.takeIntoCustody(recipient, asset));
    }

    private void save(OperationScope scope, CollateralPosition position) {
        CollateralPosition previous = positions.put(position.getId(), position);
        scope.onRollback(() -> {
            if (previous == null) {
                positions.remove(position.getId());
            } else {
                positions.put(position.getId(), previous);
            }
        });
    }

    private CollateralPosition require(long positionId) {
        CollateralPosition position = positions.get(positionId);
        if (position == null) {
            throw new PreconditionException(ErrorCode.POSITION_NOT_FOUND, "Position not found: " + positionId);
        }
        return position;
    }
}
