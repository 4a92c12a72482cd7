package com.metalend.core.service.collateral;

import com.metalend.core.config.LendingProperties;
import com.metalend.core.exception.ErrorCode;
import com.metalend.core.exception.PreconditionException;
import com.metalend.core.exception.TransferFailedException;
import com.metalend.core.exception.UnauthorizedException;
import com.metalend.core.model.AssetRef;
import com.metalend.core.model.CollateralPosition;
import com.metalend.core.model.PositionStatus;
import com.metalend.core.port.CustodyPort;
import com.metalend.core.port.InMemoryCustodyLedger;
import com.metalend.core.port.RoleRegistry;
import com.metalend.core.support.LendingFixture;
import com.metalend.core.support.MutableClock;
import com.metalend.core.support.OperationTemplate;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.metalend.core.support.LendingFixture.ADMIN;
import static com.metalend.core.support.LendingFixture.BORROWER;
import static com.metalend.core.support.LendingFixture.FEED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class CollateralLedgerTest {

    private final LendingFixture fixture = new LendingFixture();
    private final CollateralLedger ledger = fixture.ledger;

    @Test
    void depositHonoursLoanToValueBoundary() {
        AssetRef asset = fixture.deed("1", BORROWER, "10");

        assertThatThrownBy(() -> ledger.deposit(BORROWER, asset, new BigDecimal("8.01")))
                .isInstanceOf(PreconditionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.EXCEEDS_LOAN_TO_VALUE);
        assertThat(fixture.custody.holderOf(asset)).contains(BORROWER);

        long positionId = ledger.deposit(BORROWER, asset, new BigDecimal("8"));

        CollateralPosition position = ledger.getPosition(positionId);
        assertThat(position.getStatus()).isEqualTo(PositionStatus.ACTIVE);
        assertThat(position.getValueAtDeposit()).isEqualByComparingTo("10");
        assertThat(fixture.custody.holderOf(asset)).contains(InMemoryCustodyLedger.CUSTODIAN);
    }

    @Test
    void assetCannotBePledgedTwiceWhileActive() {
        AssetRef asset = fixture.deed("1", BORROWER, "10");
        long first = ledger.deposit(BORROWER, asset, BigDecimal.ONE);

        assertThatThrownBy(() -> ledger.deposit(BORROWER, asset, BigDecimal.ONE))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ALREADY_PLEDGED);

        ledger.withdraw(BORROWER, first);
        long second = ledger.deposit(BORROWER, asset, BigDecimal.ONE);

        assertThat(second).isNotEqualTo(first);
        assertThat(ledger.getPosition(first).getStatus()).isEqualTo(PositionStatus.WITHDRAWN);
        assertThat(ledger.activePositionFor(asset)).map(CollateralPosition::getId).contains(second);
        assertThat(ledger.positionsOf(BORROWER)).hasSize(2);
        assertThat(ledger.activeCount()).isEqualTo(1);
    }

    @Test
    void withdrawReturnsCustodyToOwnerOnly() {
        AssetRef asset = fixture.deed("1", BORROWER, "10");
        long positionId = ledger.deposit(BORROWER, asset, BigDecimal.ONE);

        assertThatThrownBy(() -> ledger.withdraw("stranger", positionId))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_OWNER);

        ledger.withdraw(BORROWER, positionId);

        assertThat(fixture.custody.holderOf(asset)).contains(BORROWER);
        assertThatThrownBy(() -> ledger.withdraw(BORROWER, positionId))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.POSITION_NOT_ACTIVE);
    }

    @Test
    void encumberedPositionCannotBeWithdrawn() {
        AssetRef asset = fixture.deed("1", BORROWER, "10");
        long positionId = ledger.deposit(BORROWER, asset, BigDecimal.ONE);
        ledger.encumber("lending-pool", positionId, 42L);

        assertThatThrownBy(() -> ledger.withdraw(BORROWER, positionId))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.POSITION_ENCUMBERED);

        ledger.release("lending-pool", positionId, 42L);
        ledger.withdraw(BORROWER, positionId);
        assertThat(ledger.getPosition(positionId).isActive()).isFalse();
    }

    @Test
    void forceCloseIsReservedForLiquidationEngine() {
        AssetRef asset = fixture.deed("1", BORROWER, "10");
        long positionId = ledger.deposit(BORROWER, asset, BigDecimal.ONE);

        assertThatThrownBy(() -> ledger.forceClose(BORROWER, positionId, BORROWER))
                .isInstanceOf(UnauthorizedException.class);

        ledger.forceClose("liquidation-engine", positionId, "buyer");

        assertThat(ledger.getPosition(positionId).getStatus()).isEqualTo(PositionStatus.LIQUIDATED);
        assertThat(fixture.custody.holderOf(asset)).contains("buyer");
        assertThat(ledger.activePositionFor(asset)).isEmpty();
    }

    @Test
    void failedCustodyTransferLeavesNoPosition() {
        LendingProperties properties = new LendingProperties();
        RoleRegistry roles = new RoleRegistry(properties);
        CustodyPort custody = mock(CustodyPort.class);
        doThrow(new TransferFailedException("custody offline")).when(custody).takeIntoCustody(any(), any());
        List<Object> published = new ArrayList<>();
        CollateralLedger isolated = new CollateralLedger(properties, asset -> new BigDecimal("10"), custody, roles,
                new OperationTemplate(published::add), new MutableClock(LendingFixture.START));
        AssetRef asset = AssetRef.of("deed", "9");

        assertThatThrownBy(() -> isolated.deposit(BORROWER, asset, BigDecimal.ONE))
                .isInstanceOf(TransferFailedException.class);

        assertThat(isolated.activePositionFor(asset)).isEmpty();
        assertThat(isolated.positionsOf(BORROWER)).isEmpty();
        assertThat(published).isEmpty();
        verify(custody, never()).releaseFromCustody(any(), any());
    }

    @Test
    void batchValuationMarksEveryPositionOrNone() {
        AssetRef first = fixture.deed("1", BORROWER, "10");
        AssetRef second = fixture.deed("2", BORROWER, "20");
        long a = ledger.deposit(BORROWER, first, BigDecimal.ONE);
        long b = ledger.deposit(BORROWER, second, BigDecimal.ONE);
        fixture.oracle.setSpotPrice(FEED, "deed", "1", new BigDecimal("11"));

        assertThatThrownBy(() -> ledger.batchUpdateValuations(FEED, List.of(a, 99L)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.POSITION_NOT_FOUND);
        assertThat(ledger.getPosition(a).getMarkedValue()).isEqualByComparingTo("10");

        ledger.batchUpdateValuations(FEED, List.of(a, b));
        assertThat(ledger.getPosition(a).getMarkedValue()).isEqualByComparingTo("11");
        assertThat(ledger.getPosition(b).getMarkedValue()).isEqualByComparingTo("20");
    }

    @Test
    void loanToValueBoundIsAdminTunable() {
        assertThatThrownBy(() -> ledger.setLoanToValueMax(BORROWER, new BigDecimal("0.5")))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> ledger.setLoanToValueMax(ADMIN, new BigDecimal("1.1")))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_PARAMETER);

        ledger.setLoanToValueMax(ADMIN, new BigDecimal("0.5"));
        AssetRef asset = fixture.deed("1", BORROWER, "10");

        assertThatThrownBy(() -> ledger.deposit(BORROWER, asset, new BigDecimal("6")))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.EXCEEDS_LOAN_TO_VALUE);
    }
}
