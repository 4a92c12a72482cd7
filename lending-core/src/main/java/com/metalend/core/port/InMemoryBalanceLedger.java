package com.metalend.core.port;

import com.metalend.core.exception.TransferFailedException;
import com.metalend.core.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Fungible balances plus the protocol treasury, used when no external settlement system is wired in.
 * Every access is serialized on the ledger instance.
 */
@Slf4j
@Component
public class InMemoryBalanceLedger implements BalancePort {

    private final Map<String, BigDecimal> balances = new HashMap<>();
    private BigDecimal treasury = MoneyUtils.ZERO;

    public synchronized void credit(String party, BigDecimal amount) {
        balances.merge(party, MoneyUtils.scale(amount), MoneyUtils::add);
    }

    public synchronized BigDecimal balanceOf(String party) {
        return balances.getOrDefault(party, MoneyUtils.ZERO);
    }

    public synchronized BigDecimal treasuryBalance() {
        return treasury;
    }

    @Override
    public synchronized void collect(String from, BigDecimal amount) {
        BigDecimal balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            throw new TransferFailedException("Insufficient balance for " + from + ": has " + balance + ", needs " + amount);
        }
        balances.put(from, MoneyUtils.subtract(balance, amount));
        treasury = MoneyUtils.add(treasury, amount);
        log.debug("Balance collected from={} amount={}", from, amount);
    }

    @Override
    public synchronized void payOut(String to, BigDecimal amount) {
        if (treasury.compareTo(amount) < 0) {
            throw new TransferFailedException("Treasury cannot cover payout of " + amount);
        }
        treasury = MoneyUtils.subtract(treasury, amount);
        balances.merge(to, MoneyUtils.scale(amount), MoneyUtils::add);
        log.debug("Balance paid to={} amount={}", to, amount);
    }
}
