package com.metalend.core.service.pool;

import com.metalend.core.config.LendingProperties;
import com.metalend.core.event.LendingEvent;
import com.metalend.core.event.LendingEventType;
import com.metalend.core.exception.ErrorCode;
import com.metalend.core.exception.PreconditionException;
import com.metalend.core.exception.ValidationException;
import com.metalend.core.model.CollateralPosition;
import com.metalend.core.model.Loan;
import com.metalend.core.model.LoanStatus;
import com.metalend.core.model.PoolState;
import com.metalend.core.port.AuthorizationPort;
import com.metalend.core.port.BalancePort;
import com.metalend.core.port.Role;
import com.metalend.core.service.collateral.CollateralLedger;
import com.metalend.core.support.OperationScope;
import com.metalend.core.support.OperationTemplate;
import com.metalend.core.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pooled lender liquidity, proportional shares and the loans drawn against it.
 * <p>
 * Shares are issued {@code amount * totalShares / totalLiquidity}, rounded down, so earlier providers
 * keep the rounding remainder. Loans carry the utilization rate snapshotted at origination and accrue
 * simple interest lazily. Repayments settle interest first; the principal part frees borrowed liquidity,
 * the interest part is split between reserves and lenders.
 */
@Slf4j
@Service
public class LiquidityPool {

    static final BigDecimal SECONDS_PER_YEAR = BigDecimal.valueOf(365L * 24 * 60 * 60);

    private final CollateralLedger ledger;
    private final BalancePort balances;
    private final AuthorizationPort authorization;
    private final OperationTemplate operations;
    private final Clock clock;
    private final String poolIdentity;
    private final Duration maxLoanDuration;

    private final Map<String, BigDecimal> shares = new HashMap<>();
    private final Map<Long, Loan> loans = new LinkedHashMap<>();
    private final Map<String, List<Long>> loansByBorrower = new HashMap<>();
    private PoolState state = PoolState.empty();
    private long nextLoanId = 1L;

    private BigDecimal baseRate;
    private BigDecimal slope;
    private BigDecimal reserveFactor;

    public LiquidityPool(LendingProperties properties, CollateralLedger ledger, BalancePort balances,
                         AuthorizationPort authorization, OperationTemplate operations, Clock clock) {
        LendingProperties.Pool cfg = properties.getPool();
        this.ledger = ledger;
        this.balances = balances;
        this.authorization = authorization;
        this.operations = operations;
        this.clock = clock;
        this.poolIdentity = properties.getSecurity().getPoolIdentity();
        this.maxLoanDuration = cfg.getMaxLoanDuration();
        this.baseRate = cfg.getBaseRate();
        this.slope = cfg.getSlope();
        this.reserveFactor = cfg.getReserveFactor();
    }

    public BigDecimal provide(String party, BigDecimal amount) {
        return operations.execute("pool.provide", scope -> {
            requireAmount(amount);
            BigDecimal scaled = MoneyUtils.scale(amount);
            BigDecimal minted = sharesFor(scaled);
            if (minted.signum() == 0) {
                throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Amount too small to mint shares");
            }
            setState(scope, state.withLiquidity(state.totalLiquidity().add(scaled), state.totalShares().add(minted)));
            setShares(scope, party, sharesOf(party).add(minted));

            balances.collect(party, scaled);
            scope.onRollback(() -> balances.payOut(party, scaled));

            scope.publish(LendingEvent.of(LendingEventType.LIQUIDITY_PROVIDED, party, party, clock.instant(),
                    Map.of("amount", scaled, "shares", minted)));
            log.info("Liquidity provided party={} amount={} shares={}", party, scaled, minted);
            return minted;
        });
    }

    public BigDecimal withdraw(String party, BigDecimal shareAmount) {
        return operations.execute("pool.withdraw", scope -> {
            requireAmount(shareAmount);
            BigDecimal burned = MoneyUtils.scale(shareAmount);
            BigDecimal held = sharesOf(party);
            if (burned.compareTo(held) > 0) {
                throw new PreconditionException(ErrorCode.INSUFFICIENT_SHARES, "Insufficient shares: has " + held);
            }
            BigDecimal amount = MoneyUtils.mulDiv(burned, state.totalLiquidity(), state.totalShares());
            if (amount.compareTo(state.available()) > 0) {
                throw new PreconditionException(ErrorCode.INSUFFICIENT_AVAILABLE_LIQUIDITY,
                        "Only " + state.available() + " available, requested " + amount);
            }
            setState(scope, state.withLiquidity(state.totalLiquidity().subtract(amount), state.totalShares().subtract(burned)));
            setShares(scope, party, held.subtract(burned));

            balances.payOut(party, amount);
            scope.onRollback(() -> balances.collect(party, amount));

            scope.publish(LendingEvent.of(LendingEventType.LIQUIDITY_WITHDRAWN, party, party, clock.instant(),
                    Map.of("amount", amount, "shares", burned)));
            log.info("Liquidity withdrawn party={} amount={} shares={}", party, amount, burned);
            return amount;
        });
    }

    /** {@code baseRate + utilization * slope}; utilization is 0 for an empty pool. */
    public BigDecimal currentRate() {
        return baseRate.add(state.utilization().multiply(slope)).setScale(MoneyUtils.RATIO_SCALE, RoundingMode.DOWN);
    }

    public long originate(String party, long positionId, BigDecimal amount, Duration duration) {
        return operations.execute("pool.originate", scope -> {
            requireAmount(amount);
            if (duration == null || duration.isZero() || duration.isNegative() || duration.compareTo(maxLoanDuration) > 0) {
                throw new ValidationException(ErrorCode.INVALID_DURATION, "Invalid loan duration: " + duration);
            }
            BigDecimal principal = MoneyUtils.scale(amount);
            CollateralPosition position = ledger.getPosition(positionId);
            if (!position.getOwner().equals(party)) {
                throw new PreconditionException(ErrorCode.NOT_OWNER, "Not the collateral owner");
            }
            if (!ledger.isHealthy(positionId)) {
                throw new PreconditionException(ErrorCode.POSITION_NOT_ACTIVE, "Collateral not active");
            }
            if (position.isEncumbered()) {
                throw new PreconditionException(ErrorCode.POSITION_ENCUMBERED, "Collateral already backs a loan");
            }
            BigDecimal value = ledger.valueOf(positionId);
            if (principal.compareTo(value.multiply(position.getLoanToValueBound())) > 0) {
                throw new PreconditionException(ErrorCode.EXCEEDS_LOAN_TO_VALUE,
                        "Loan " + principal + " exceeds bound " + position.getLoanToValueBound() + " of value " + value);
            }
            if (principal.compareTo(state.available()) > 0) {
                throw new PreconditionException(ErrorCode.INSUFFICIENT_LIQUIDITY, "Insufficient liquidity");
            }

            Instant now = clock.instant();
            BigDecimal rate = currentRate();
            long loanId = nextLoanId++;
            Loan loan = Loan.builder()
                    .id(loanId)
                    .borrower(party)
                    .positionId(positionId)
                    .principal(principal)
                    .rate(rate)
                    .originatedAt(now)
                    .maturesAt(now.plus(duration))
                    .principalRepaid(MoneyUtils.ZERO)
                    .interestRepaid(MoneyUtils.ZERO)
                    .totalRepaid(MoneyUtils.ZERO)
                    .status(LoanStatus.ACTIVE)
                    .build();
            save(scope, loan);
            List<Long> borrowed = loansByBorrower.computeIfAbsent(party, key -> new ArrayList<>());
            borrowed.add(loanId);
            scope.onRollback(() -> borrowed.remove(Long.valueOf(loanId)));
            setState(scope, state.withBorrowed(state.totalBorrowed().add(principal)));
            ledger.encumber(poolIdentity, positionId, loanId);

            balances.payOut(party, principal);
            scope.onRollback(() -> balances.collect(party, principal));

            scope.publish(LendingEvent.of(LendingEventType.LOAN_ORIGINATED, loanId, party, now,
                    Map.of("principal", principal, "rate", rate, "positionId", BigDecimal.valueOf(positionId))));
            log.info("Loan originated loanId={} positionId={} borrower={} principal={} rate={}",
                    loanId, positionId, party, principal, rate);
            return loanId;
        });
    }

    /** Simple interest on the full principal, {@code principal * rate * elapsed / year}. */
    public BigDecimal accruedInterest(long loanId) {
        return accruedInterest(require(loanId), clock.instant());
    }

    public BigDecimal outstandingDebt(long loanId) {
        return outstandingDebt(require(loanId), clock.instant());
    }

    /**
     * Applies at most the outstanding debt and returns the amount actually applied.
     */
    public BigDecimal repay(String party, long loanId, BigDecimal amount) {
        return operations.execute("pool.repay", scope -> {
            requireAmount(amount);
            Loan loan = require(loanId);
            if (!loan.getBorrower().equals(party)) {
                throw new PreconditionException(ErrorCode.NOT_BORROWER, "Not loan borrower");
            }
            if (!loan.isActive()) {
                throw new PreconditionException(ErrorCode.LOAN_NOT_ACTIVE, "Loan " + loanId + " is " + loan.getStatus());
            }
            Instant now = clock.instant();
            BigDecimal applied = MoneyUtils.min(MoneyUtils.scale(amount), outstandingDebt(loan, now));
            Loan updated = applyPayment(scope, loan, applied, now);
            if (outstandingDebt(updated, now).signum() == 0) {
                updated = updated.toBuilder().status(LoanStatus.REPAID).closedAt(now).build();
                save(scope, updated);
                ledger.release(poolIdentity, loan.getPositionId(), loanId);
            }

            balances.collect(party, applied);
            scope.onRollback(() -> balances.payOut(party, applied));

            scope.publish(LendingEvent.of(LendingEventType.LOAN_REPAID, loanId, party, now,
                    Map.of("applied", applied, "totalRepaid", updated.getTotalRepaid(),
                            "outstanding", outstandingDebt(updated, now))));
            log.info("Loan repaid loanId={} borrower={} applied={} status={}", loanId, party, applied, updated.getStatus());
            return applied;
        });
    }

    /**
     * Closes a loan on behalf of the liquidation engine, which has collected the full outstanding debt.
     * Returns the debt settled.
     */
    public BigDecimal settleLiquidation(String caller, long loanId) {
        return operations.execute("pool.settleLiquidation", scope -> {
            authorization.require(caller, Role.LIQUIDATION_ENGINE);
            Loan loan = require(loanId);
            if (!loan.isActive()) {
                throw new PreconditionException(ErrorCode.LOAN_NOT_ACTIVE, "Loan " + loanId + " is " + loan.getStatus());
            }
            Instant now = clock.instant();
            BigDecimal debt = outstandingDebt(loan, now);
            Loan updated = applyPayment(scope, loan, debt, now).toBuilder()
                    .status(LoanStatus.LIQUIDATED)
                    .closedAt(now)
                    .build();
            save(scope, updated);
            ledger.release(poolIdentity, loan.getPositionId(), loanId);

            scope.publish(LendingEvent.of(LendingEventType.LOAN_LIQUIDATED, loanId, loan.getBorrower(), now,
                    Map.of("debt", debt)));
            log.warn("Loan liquidated loanId={} positionId={} debt={}", loanId, loan.getPositionId(), debt);
            return debt;
        });
    }

    /** False once past maturity with debt left, otherwise the backing position's health. */
    public boolean isHealthy(long loanId) {
        Loan loan = require(loanId);
        Instant now = clock.instant();
        if (loan.isActive() && now.isAfter(loan.getMaturesAt()) && outstandingDebt(loan, now).signum() > 0) {
            return false;
        }
        return ledger.isHealthy(loan.getPositionId());
    }

    public Loan getLoan(long loanId) {
        return require(loanId);
    }

    public List<Loan> loansOf(String borrower) {
        return loansByBorrower.getOrDefault(borrower, List.of()).stream()
                .map(loans::get)
                .toList();
    }

    public BigDecimal sharesOf(String party) {
        return shares.getOrDefault(party, MoneyUtils.ZERO);
    }

    public PoolState poolState() {
        return state;
    }

    public long activeLoanCount() {
        return loans.values().stream().filter(Loan::isActive).count();
    }

    /** Principal plus accrued interest still owed across every active loan. */
    public BigDecimal totalOutstanding() {
        Instant now = clock.instant();
        return loans.values().stream()
                .filter(Loan::isActive)
                .map(loan -> outstandingDebt(loan, now))
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);
    }

    public BigDecimal getBaseRate() {
        return baseRate;
    }

    public BigDecimal getSlope() {
        return slope;
    }

    public BigDecimal getReserveFactor() {
        return reserveFactor;
    }

    /** Applies to loans originated after the change; existing loans keep their snapshotted rate. */
    public void setRateModel(String caller, BigDecimal newBaseRate, BigDecimal newSlope) {
        operations.run("pool.setRateModel", scope -> {
            authorization.require(caller, Role.ADMIN);
            if (newBaseRate == null || newBaseRate.signum() < 0 || newSlope == null || newSlope.signum() < 0) {
                throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Rate model values must be non-negative");
            }
            BigDecimal previousBase = baseRate;
            BigDecimal previousSlope = slope;
            baseRate = newBaseRate;
            slope = newSlope;
            scope.onRollback(() -> {
                baseRate = previousBase;
                slope = previousSlope;
            });
            scope.publish(LendingEvent.of(LendingEventType.RATE_MODEL_UPDATED, "rate-model", caller, clock.instant(),
                    Map.of("baseRate", newBaseRate, "slope", newSlope)));
            log.info("Rate model updated baseRate={} slope={}", newBaseRate, newSlope);
        });
    }

    public void setReserveFactor(String caller, BigDecimal factor) {
        operations.run("pool.setReserveFactor", scope -> {
            authorization.require(caller, Role.ADMIN);
            if (factor == null || factor.signum() < 0 || factor.compareTo(BigDecimal.ONE) > 0) {
                throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Reserve factor must be in [0, 1]");
            }
            BigDecimal previous = reserveFactor;
            reserveFactor = factor;
            scope.onRollback(() -> reserveFactor = previous);
            scope.publish(LendingEvent.of(LendingEventType.RESERVE_FACTOR_UPDATED, "reserve-factor", caller, clock.instant(),
                    Map.of("reserveFactor", factor)));
        });
    }

    private BigDecimal sharesFor(BigDecimal amount) {
        if (state.totalShares().signum() == 0 || state.totalLiquidity().signum() == 0) {
            return amount;
        }
        return MoneyUtils.mulDiv(amount, state.totalShares(), state.totalLiquidity());
    }

    /** Interest first, then principal. */
    private Loan applyPayment(OperationScope scope, Loan loan, BigDecimal payment, Instant now) {
        BigDecimal interestDue = MoneyUtils.floorAtZero(accruedInterest(loan, now).subtract(loan.getInterestRepaid()));
        BigDecimal interestPart = MoneyUtils.min(payment, interestDue);
        BigDecimal principalPart = payment.subtract(interestPart);
        BigDecimal reserve = MoneyUtils.applyRatio(interestPart, reserveFactor);
        BigDecimal lenderInterest = interestPart.subtract(reserve);

        setState(scope, state.with(
                state.totalLiquidity().add(lenderInterest),
                state.totalBorrowed().subtract(principalPart),
                state.totalReserves().add(reserve)));
        Loan updated = loan.toBuilder()
                .interestRepaid(MoneyUtils.add(loan.getInterestRepaid(), interestPart))
                .principalRepaid(MoneyUtils.add(loan.getPrincipalRepaid(), principalPart))
                .totalRepaid(MoneyUtils.add(loan.getTotalRepaid(), payment))
                .build();
        save(scope, updated);
        return updated;
    }

    private BigDecimal accruedInterest(Loan loan, Instant now) {
        long elapsed = Math.max(0L, Duration.between(loan.getOriginatedAt(), loan.accrualEnd(now)).getSeconds());
        return loan.getPrincipal()
                .multiply(loan.getRate())
                .multiply(BigDecimal.valueOf(elapsed))
                .divide(SECONDS_PER_YEAR, MoneyUtils.SCALE, RoundingMode.DOWN);
    }

    private BigDecimal outstandingDebt(Loan loan, Instant now) {
        BigDecimal owed = loan.getPrincipal().add(accruedInterest(loan, now)).subtract(loan.getTotalRepaid());
        return MoneyUtils.floorAtZero(MoneyUtils.scale(owed));
    }

    private void setState(OperationScope scope, PoolState next) {
        PoolState previous = state;
        state = next;
        scope.onRollback(() -> state = previous);
    }

    private void setShares(OperationScope scope, String party, BigDecimal balance) {
        BigDecimal previous = shares.put(party, MoneyUtils.scale(balance));
        scope.onRollback(() -> {
            if (previous == null) {
                shares.remove(party);
            } else {
                shares.put(party, previous);
            }
        });
    }

    private void save(OperationScope scope, Loan loan) {
        Loan previous = loans.put(loan.getId(), loan);
        scope.onRollback(() -> {
            if (previous == null) {
                loans.remove(loan.getId());
            } else {
                loans.put(loan.getId(), previous);
            }
        });
    }

    private Loan require(long loanId) {
        Loan loan = loans.get(loanId);
        if (loan == null) {
            throw new PreconditionException(ErrorCode.LOAN_NOT_FOUND, "Loan not found: " + loanId);
        }
        return loan;
    }

    private static void requireAmount(BigDecimal amount) {
        if (!MoneyUtils.isPositive(amount) || MoneyUtils.scale(amount).signum() == 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
    }
}
