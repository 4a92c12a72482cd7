package com.metalend.core.port;

import java.math.BigDecimal;

/**
 * Atomic fungible balance transfer between a party and the protocol treasury.
 */
public interface BalancePort {

    void collect(String from, BigDecimal amount);

    void payOut(String to, BigDecimal amount);
}
