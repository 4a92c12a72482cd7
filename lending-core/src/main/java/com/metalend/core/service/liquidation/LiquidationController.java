package com.metalend.core.service.liquidation;

import com.metalend.core.config.LendingProperties;
import com.metalend.core.event.LendingEvent;
import com.metalend.core.event.LendingEventType;
import com.metalend.core.exception.ErrorCode;
import com.metalend.core.exception.LendingException;
import com.metalend.core.exception.PreconditionException;
import com.metalend.core.exception.ValidationException;
import com.metalend.core.model.CollateralPosition;
import com.metalend.core.model.LiquidationParameters;
import com.metalend.core.model.LiquidationRecord;
import com.metalend.core.model.LiquidationStatus;
import com.metalend.core.model.Loan;
import com.metalend.core.port.AuthorizationPort;
import com.metalend.core.port.BalancePort;
import com.metalend.core.port.Role;
import com.metalend.core.service.collateral.CollateralLedger;
import com.metalend.core.service.pool.LiquidityPool;
import com.metalend.core.support.OperationScope;
import com.metalend.core.support.OperationTemplate;
import com.metalend.core.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-position liquidation: Healthy -> Eligible -> Triggered -> (Executed | re-Eligible).
 * <p>
 * Anyone may trigger an eligible position and, once the delay has elapsed, execute it. The delay is a
 * grace period: a trigger is cancelled as soon as the position is seen healthy again, either when a
 * committed repayment or price change cures it or when execution finds it cured. A later dip needs a new
 * trigger and a new delay. The first successful execution wins; every later one fails
 * {@link ErrorCode#ALREADY_LIQUIDATED}.
 */
@Slf4j
@Service
public class LiquidationController {

    static final BigDecimal MAX_BONUS_RATE = new BigDecimal("0.20");
    static final Duration MAX_DELAY = Duration.ofHours(24);

    private static final Set<LendingEventType> HEALTH_CHANGES = EnumSet.of(
            LendingEventType.SPOT_PRICE_UPDATED,
            LendingEventType.FLOOR_PRICE_UPDATED,
            LendingEventType.LOAN_REPAID,
            LendingEventType.COLLATERAL_RELEASED,
            LendingEventType.LIQUIDATION_PARAMETERS_UPDATED);

    private final CollateralLedger ledger;
    private final LiquidityPool pool;
    private final BalancePort balances;
    private final AuthorizationPort authorization;
    private final OperationTemplate operations;
    private final Clock clock;
    private final String engineIdentity;

    private final Map<Long, LiquidationRecord> records = new HashMap<>();
    private LiquidationParameters parameters;

    public LiquidationController(LendingProperties properties, CollateralLedger ledger, LiquidityPool pool,
                                 BalancePort balances, AuthorizationPort authorization,
                                 OperationTemplate operations, Clock clock) {
        LendingProperties.Liquidation cfg = properties.getLiquidation();
        this.ledger = ledger;
        this.pool = pool;
        this.balances = balances;
        this.authorization = authorization;
        this.operations = operations;
        this.clock = clock;
        this.engineIdentity = properties.getSecurity().getEngineIdentity();
        this.parameters = new LiquidationParameters(cfg.getThreshold(), cfg.getBonusRate(), cfg.getDelay());
    }

    /** {@code value * threshold < debt} for an active position backing an active loan. */
    public boolean isEligible(long positionId) {
        CollateralPosition position = ledger.getPosition(positionId);
        if (!position.isActive() || !position.isEncumbered()) {
            return false;
        }
        Loan loan = pool.getLoan(position.getLinkedLoanId());
        if (!loan.isActive()) {
            return false;
        }
        BigDecimal debt = pool.outstandingDebt(loan.getId());
        BigDecimal value = ledger.valueOf(positionId);
        return value.multiply(parameters.threshold()).compareTo(debt) < 0;
    }

    /**
     * Flags an eligible position. Triggering again before execution refreshes the snapshot and restarts
     * the delay.
     */
    public LiquidationRecord trigger(String caller, long positionId) {
        return operations.execute("liquidation.trigger", scope -> {
            LiquidationRecord existing = records.get(positionId);
            if (existing != null && existing.isLiquidated()) {
                throw new PreconditionException(ErrorCode.ALREADY_LIQUIDATED, "Already liquidated");
            }
            if (!isEligible(positionId)) {
                throw new PreconditionException(ErrorCode.NOT_ELIGIBLE, "Not eligible for liquidation");
            }
            CollateralPosition position = ledger.getPosition(positionId);
            long loanId = position.getLinkedLoanId();
            BigDecimal debt = pool.outstandingDebt(loanId);
            BigDecimal value = ledger.valueOf(positionId);
            BigDecimal bonus = calculateBonus(value);
            Instant now = clock.instant();
            LiquidationRecord record = LiquidationRecord.builder()
                    .positionId(positionId)
                    .loanId(loanId)
                    .debtSnapshot(debt)
                    .valueSnapshot(value)
                    .bonus(bonus)
                    .status(LiquidationStatus.TRIGGERED)
                    .triggeredBy(caller)
                    .triggeredAt(now)
                    .build();
            save(scope, record);
            scope.publish(LendingEvent.of(LendingEventType.LIQUIDATION_TRIGGERED, positionId, caller, now,
                    Map.of("debt", debt, "value", value, "bonus", bonus)));
            log.warn("Liquidation triggered positionId={} loanId={} debt={} value={} refreshed={}",
                    positionId, loanId, debt, value, existing != null && existing.isLive());
            return record;
        });
    }

    /**
     * Settles the loan, moves custody of the collateral to the caller, collects {@code debt + bonus} from the
     * caller and pays the bonus back. Debt and bonus are taken at execution time with the parameters then in
     * force. A position found healthy again is cancelled and the call fails {@link ErrorCode#NOT_ELIGIBLE};
     * the cancellation itself is kept.
     */
    public LiquidationRecord execute(String caller, long positionId) {
        LiquidationRecord outcome = operations.execute("liquidation.execute", scope -> {
            LiquidationRecord record = records.get(positionId);
            if (record != null && record.isLiquidated()) {
                throw new PreconditionException(ErrorCode.ALREADY_LIQUIDATED, "Already liquidated");
            }
            if (record == null || !record.isLive()) {
                throw new PreconditionException(ErrorCode.NOT_TRIGGERED, "Liquidation not triggered for " + positionId);
            }
            Instant now = clock.instant();
            Duration elapsed = Duration.between(record.getTriggeredAt(), now);
            if (elapsed.compareTo(parameters.delay()) < 0) {
                throw new PreconditionException(ErrorCode.DELAY_NOT_ELAPSED,
                        "Liquidation delay not met, " + parameters.delay().minus(elapsed).getSeconds() + "s remaining");
            }
            if (!backsSameLoan(record) || !isEligible(positionId)) {
                return cancel(scope, record, caller);
            }
            BigDecimal value = ledger.valueOf(positionId);
            BigDecimal bonus = calculateBonus(value);

            BigDecimal debt = pool.settleLiquidation(engineIdentity, record.getLoanId());
            LiquidationRecord executed = record.toBuilder()
                    .debtSnapshot(debt)
                    .valueSnapshot(value)
                    .bonus(bonus)
                    .status(LiquidationStatus.EXECUTED)
                    .liquidator(caller)
                    .executedAt(now)
                    .build();
            save(scope, executed);
            ledger.forceClose(engineIdentity, positionId, caller);

            BigDecimal due = executed.amountDue();
            balances.collect(caller, due);
            scope.onRollback(() -> balances.payOut(caller, due));
            balances.payOut(caller, bonus);
            scope.onRollback(() -> balances.collect(caller, bonus));

            scope.publish(LendingEvent.of(LendingEventType.LIQUIDATION_EXECUTED, positionId, caller, now,
                    Map.of("debt", debt, "value", value, "bonus", bonus)));
            log.warn("Liquidation executed positionId={} loanId={} liquidator={} debt={} bonus={}",
                    positionId, record.getLoanId(), caller, debt, bonus);
            return executed;
        });
        if (outcome.getStatus() == LiquidationStatus.CANCELLED) {
            throw new PreconditionException(ErrorCode.NOT_ELIGIBLE, "Position recovered before execution");
        }
        return outcome;
    }

    /**
     * Cancels live triggers whose position a committed repayment, price or parameter change has made
     * healthy again.
     */
    @EventListener
    public void onLendingEvent(LendingEvent event) {
        if (!HEALTH_CHANGES.contains(event.type())) {
            return;
        }
        List<LiquidationRecord> cured = records.values().stream()
                .filter(LiquidationRecord::isLive)
                .filter(record -> !stillEligible(record))
                .toList();
        if (cured.isEmpty()) {
            return;
        }
        operations.run("liquidation.cancelCured", scope -> cured.forEach(record -> cancel(scope, record, engineIdentity)));
    }

    public BigDecimal calculateBonus(BigDecimal collateralValue) {
        return MoneyUtils.applyRatio(collateralValue, parameters.bonusRate());
    }

    /** Time left before a triggered position may be executed; zero when not pending. */
    public Duration remainingDelay(long positionId) {
        LiquidationRecord record = records.get(positionId);
        if (record == null || !record.isLive()) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), record.getTriggeredAt().plus(parameters.delay()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean isPending(long positionId) {
        LiquidationRecord record = records.get(positionId);
        return record != null && record.isLive();
    }

    public Optional<LiquidationRecord> getRecord(long positionId) {
        return Optional.ofNullable(records.get(positionId));
    }

    public LiquidationParameters getParameters() {
        return parameters;
    }

    /**
     * Takes effect immediately for every position, including ones already triggered.
     */
    public void updateParameters(String caller, BigDecimal threshold, BigDecimal bonusRate, Duration delay) {
        operations.run("liquidation.updateParameters", scope -> {
            authorization.require(caller, Role.ADMIN);
            if (threshold == null || threshold.signum() <= 0 || threshold.compareTo(BigDecimal.ONE) > 0) {
                throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Invalid threshold");
            }
            if (bonusRate == null || bonusRate.signum() <= 0 || bonusRate.compareTo(MAX_BONUS_RATE) > 0) {
                throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Invalid bonus");
            }
            if (delay == null || delay.isNegative() || delay.compareTo(MAX_DELAY) > 0) {
                throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Delay too long");
            }
            LiquidationParameters previous = parameters;
            parameters = new LiquidationParameters(threshold, bonusRate, delay);
            scope.onRollback(() -> parameters = previous);
            scope.publish(LendingEvent.of(LendingEventType.LIQUIDATION_PARAMETERS_UPDATED, "liquidation", caller,
                    clock.instant(), Map.of("threshold", threshold, "bonusRate", bonusRate,
                            "delaySeconds", BigDecimal.valueOf(delay.getSeconds()))));
            log.info("Liquidation parameters updated threshold={} bonusRate={} delay={}", threshold, bonusRate, delay);
        });
    }

    private LiquidationRecord cancel(OperationScope scope, LiquidationRecord record, String party) {
        LiquidationRecord cancelled = record.toBuilder().status(LiquidationStatus.CANCELLED).build();
        save(scope, cancelled);
        scope.publish(LendingEvent.of(LendingEventType.LIQUIDATION_CANCELLED, record.getPositionId(), party,
                clock.instant(), Map.of("debt", record.getDebtSnapshot())));
        log.info("Liquidation cancelled positionId={} loanId={} triggeredAt={}",
                record.getPositionId(), record.getLoanId(), record.getTriggeredAt());
        return cancelled;
    }

    private boolean backsSameLoan(LiquidationRecord record) {
        CollateralPosition position = ledger.getPosition(record.getPositionId());
        return position.isActive() && Objects.equals(position.getLinkedLoanId(), record.getLoanId());
    }

    /** Unpriceable positions stay pending; execution decides once a price is back. */
    private boolean stillEligible(LiquidationRecord record) {
        if (!backsSameLoan(record)) {
            return false;
        }
        try {
            return isEligible(record.getPositionId());
        } catch (LendingException ex) {
            log.warn("Liquidation recheck skipped positionId={} reason={}", record.getPositionId(), ex.getMessage());
            return true;
        }
    }

    private void save(OperationScope scope, LiquidationRecord record) {
        LiquidationRecord previous = records.put(record.getPositionId(), record);
        scope.onRollback(() -> {
            if (previous == null) {
                records.remove(record.getPositionId());
            } else {
                records.put(record.getPositionId(), previous);
            }
        });
    }
}
