package com.metalend.core.service;

import com.metalend.core.config.LendingProperties;
import com.metalend.core.event.LendingEvent;
import com.metalend.core.event.LendingEventType;
import com.metalend.core.exception.ErrorCode;
import com.metalend.core.exception.PreconditionException;
import com.metalend.core.exception.ValidationException;
import com.metalend.core.model.AssetRef;
import com.metalend.core.model.Loan;
import com.metalend.core.port.AuthorizationPort;
import com.metalend.core.port.Role;
import com.metalend.core.service.collateral.CollateralLedger;
import com.metalend.core.service.pool.LiquidityPool;
import com.metalend.core.support.OperationTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Combined borrower entry points over the ledger and the pool. Each call is a single operation, so a
 * failed borrow leaves no deposited position behind.
 */
@Slf4j
@Service
public class LendingFacade {

    private final CollateralLedger ledger;
    private final LiquidityPool pool;
    private final AuthorizationPort authorization;
    private final OperationTemplate operations;
    private final Clock clock;
    private final Set<String> allowedAssetClasses;

    public LendingFacade(LendingProperties properties, CollateralLedger ledger, LiquidityPool pool,
                         AuthorizationPort authorization, OperationTemplate operations, Clock clock) {
        this.ledger = ledger;
        this.pool = pool;
        this.authorization = authorization;
        this.operations = operations;
        this.clock = clock;
        this.allowedAssetClasses = new HashSet<>(properties.getFacade().getAllowedAssetClasses());
    }

    public BorrowReceipt depositAndBorrow(String party, AssetRef asset, BigDecimal amount, Duration duration) {
        return operations.execute("facade.depositAndBorrow", scope -> {
            if (!isAllowed(asset.assetClass())) {
                throw new PreconditionException(ErrorCode.ASSET_CLASS_NOT_ALLOWED,
                        "Asset class not allowed: " + asset.assetClass());
            }
            long positionId = ledger.deposit(party, asset, amount);
            long loanId = pool.originate(party, positionId, amount, duration);
            log.info("Deposit and borrow party={} asset={} positionId={} loanId={}", party, asset, positionId, loanId);
            return new BorrowReceipt(positionId, loanId);
        });
    }

    /** Repays and, when the payment closes the loan, withdraws the collateral in the same operation. */
    public RepayReceipt repayAndWithdraw(String party, long loanId, BigDecimal amount) {
        return operations.execute("facade.repayAndWithdraw", scope -> {
            BigDecimal applied = pool.repay(party, loanId, amount);
            Loan loan = pool.getLoan(loanId);
            boolean withdrawn = false;
            if (!loan.isActive()) {
                ledger.withdraw(party, loan.getPositionId());
                withdrawn = true;
            }
            return new RepayReceipt(applied, withdrawn);
        });
    }

    public ProtocolInfo protocolInfo() {
        return new ProtocolInfo(
                pool.poolState().totalLiquidity(),
                pool.totalOutstanding(),
                ledger.activeCount(),
                pool.activeLoanCount());
    }

    public boolean isAllowed(String assetClass) {
        return allowedAssetClasses.contains(assetClass);
    }

    public void setAssetClassAllowed(String caller, String assetClass, boolean allowed) {
        operations.run("facade.setAssetClassAllowed", scope -> {
            authorization.require(caller, Role.ADMIN);
            if (assetClass == null || assetClass.isBlank()) {
                throw new ValidationException(ErrorCode.INVALID_ASSET, "Asset class must not be blank");
            }
            boolean changed = allowed ? allowedAssetClasses.add(assetClass) : allowedAssetClasses.remove(assetClass);
            if (changed) {
                scope.onRollback(() -> {
                    if (allowed) {
                        allowedAssetClasses.remove(assetClass);
                    } else {
                        allowedAssetClasses.add(assetClass);
                    }
                });
            }
            scope.publish(LendingEvent.of(LendingEventType.ASSET_CLASS_ALLOWED_CHANGED, assetClass, caller,
                    clock.instant()));
            log.info("Asset class allow-list updated assetClass={} allowed={}", assetClass, allowed);
        });
    }

    public record BorrowReceipt(long positionId, long loanId) {
    }

    public record RepayReceipt(BigDecimal applied, boolean withdrawn) {
    }

    public record ProtocolInfo(BigDecimal totalLiquidity, BigDecimal totalLoansOutstanding,
                               long activeCollaterals, long activeLoans) {
    }
}
