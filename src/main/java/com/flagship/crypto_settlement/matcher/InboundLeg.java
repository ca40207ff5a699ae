package com.flagship.crypto_settlement.matcher;

import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * The part of a transaction that paid the merchant: the credited amount and
 * the account on the debit side.
 */
@Value
public class InboundLeg {

    public static final String UNKNOWN_SENDER = "unknown";

    String transactionId;
    BigInteger units;
    BigDecimal amount;
    String sender;
    String consensusTimestamp;
    String memo;
}
