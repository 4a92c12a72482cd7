package com.metalend.core.service;

import com.metalend.core.exception.ErrorCode;
import com.metalend.core.exception.PreconditionException;
import com.metalend.core.exception.UnauthorizedException;
import com.metalend.core.model.AssetRef;
import com.metalend.core.model.LoanStatus;
import com.metalend.core.model.PositionStatus;
import com.metalend.core.port.InMemoryCustodyLedger;
import com.metalend.core.support.LendingFixture;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static com.metalend.core.support.LendingFixture.ADMIN;
import static com.metalend.core.support.LendingFixture.BORROWER;
import static com.metalend.core.support.LendingFixture.FEED;
import static com.metalend.core.support.LendingFixture.LENDER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LendingFacadeTest {

    private static final Duration TERM = Duration.ofDays(90);

    private final LendingFixture fixture = new LendingFixture();
    private final LendingFacade facade = fixture.facade;

    @Test
    void exactRepaymentClosesLoanAndReturnsCollateral() {
        fixture.seedPool(LENDER, "100000");
        AssetRef asset = fixture.deed("1", BORROWER, "10");
        LendingFacade.BorrowReceipt receipt = facade.depositAndBorrow(BORROWER, asset, new BigDecimal("8"), TERM);
        fixture.clock.advance(Duration.ofDays(30));
        fixture.balances.credit(BORROWER, BigDecimal.ONE);

        BigDecimal debt = fixture.pool.outstandingDebt(receipt.loanId());
        LendingFacade.RepayReceipt repaid = facade.repayAndWithdraw(BORROWER, receipt.loanId(), debt);

        assertThat(repaid.applied()).isEqualByComparingTo(debt);
        assertThat(repaid.withdrawn()).isTrue();
        assertThat(fixture.pool.getLoan(receipt.loanId()).getStatus()).isEqualTo(LoanStatus.REPAID);
        assertThat(fixture.ledger.getPosition(receipt.positionId()).getStatus()).isEqualTo(PositionStatus.WITHDRAWN);
        assertThat(fixture.custody.holderOf(asset)).contains(BORROWER);
    }

    @Test
    void partialRepaymentKeepsCollateralPledged() {
        fixture.seedPool(LENDER, "100000");
        AssetRef asset = fixture.deed("1", BORROWER, "10");
        LendingFacade.BorrowReceipt receipt = facade.depositAndBorrow(BORROWER, asset, new BigDecimal("8"), TERM);

        LendingFacade.RepayReceipt repaid = facade.repayAndWithdraw(BORROWER, receipt.loanId(), new BigDecimal("3"));

        assertThat(repaid.withdrawn()).isFalse();
        assertThat(fixture.ledger.getPosition(receipt.positionId()).isActive()).isTrue();
        assertThat(fixture.custody.holderOf(asset)).contains(InMemoryCustodyLedger.CUSTODIAN);
    }

    @Test
    void failedBorrowUndoesDeposit() {
        fixture.seedPool(LENDER, "5");
        AssetRef asset = fixture.deed("1", BORROWER, "10");

        assertThatThrownBy(() -> facade.depositAndBorrow(BORROWER, asset, new BigDecimal("8"), TERM))
                .isInstanceOf(PreconditionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INSUFFICIENT_LIQUIDITY);

        assertThat(fixture.ledger.activePositionFor(asset)).isEmpty();
        assertThat(fixture.ledger.activeCount()).isZero();
        assertThat(fixture.custody.holderOf(asset)).contains(BORROWER);
    }

    @Test
    void assetClassMustBeAllowed() {
        fixture.seedPool(LENDER, "1000");
        fixture.oracle.setAssetClassSupport(ADMIN, "painting", true);
        AssetRef painting = AssetRef.of("painting", "mona");
        fixture.custody.register(painting, BORROWER);
        fixture.oracle.setSpotPrice(FEED, "painting", "mona", new BigDecimal("100"));

        assertThatThrownBy(() -> facade.depositAndBorrow(BORROWER, painting, BigDecimal.ONE, TERM))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ASSET_CLASS_NOT_ALLOWED);
        assertThatThrownBy(() -> facade.setAssetClassAllowed(BORROWER, "painting", true))
                .isInstanceOf(UnauthorizedException.class);

        facade.setAssetClassAllowed(ADMIN, "painting", true);

        assertThat(facade.depositAndBorrow(BORROWER, painting, BigDecimal.ONE, TERM).loanId()).isPositive();
    }

    @Test
    void protocolInfoAggregatesPoolAndLedger() {
        fixture.seedPool(LENDER, "1000");
        facade.depositAndBorrow(BORROWER, fixture.deed("1", BORROWER, "10"), new BigDecimal("8"), TERM);
        fixture.ledger.deposit(BORROWER, fixture.deed("2", BORROWER, "10"), BigDecimal.ONE);

        LendingFacade.ProtocolInfo info = facade.protocolInfo();

        assertThat(info.totalLiquidity()).isEqualByComparingTo("1000");
        assertThat(info.totalLoansOutstanding()).isEqualByComparingTo("8");
        assertThat(info.activeCollaterals()).isEqualTo(2);
        assertThat(info.activeLoans()).isEqualTo(1);
    }
}
