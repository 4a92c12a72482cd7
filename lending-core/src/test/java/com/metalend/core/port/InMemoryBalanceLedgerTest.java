package com.metalend.core.port;

import com.metalend.core.exception.TransferFailedException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryBalanceLedgerTest {

    private final InMemoryBalanceLedger ledger = new InMemoryBalanceLedger();

    @Test
    void concurrentTransfersConserveFunds() throws Exception {
        int parties = 8;
        int transfers = 500;
        for (int i = 0; i < parties; i++) {
            ledger.credit("party-" + i, new BigDecimal(transfers));
        }
        ExecutorService executor = Executors.newFixedThreadPool(parties);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < parties; i++) {
                String party = "party-" + i;
                futures.add(executor.submit(() -> {
                    for (int n = 0; n < transfers; n++) {
                        ledger.collect(party, BigDecimal.ONE);
                        if (n % 2 == 0) {
                            ledger.payOut(party, BigDecimal.ONE);
                        }
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        BigDecimal held = BigDecimal.ZERO;
        for (int i = 0; i < parties; i++) {
            held = held.add(ledger.balanceOf("party-" + i));
        }
        assertThat(ledger.treasuryBalance()).isEqualByComparingTo(new BigDecimal(parties * transfers / 2));
        assertThat(held.add(ledger.treasuryBalance())).isEqualByComparingTo(new BigDecimal(parties * transfers));
    }

    @Test
    void rejectsOverdraft() {
        ledger.credit("party", BigDecimal.ONE);

        assertThatThrownBy(() -> ledger.collect("party", BigDecimal.TEN))
                .isInstanceOf(TransferFailedException.class);
        assertThatThrownBy(() -> ledger.payOut("party", BigDecimal.TEN))
                .isInstanceOf(TransferFailedException.class);
        assertThat(ledger.balanceOf("party")).isEqualByComparingTo("1");
    }
}
