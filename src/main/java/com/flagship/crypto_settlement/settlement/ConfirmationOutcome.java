package com.flagship.crypto_settlement.settlement;

import com.flagship.crypto_settlement.matcher.InboundLeg;
import com.flagship.crypto_settlement.validation.PaymentValidation;
import lombok.Value;

/**
 * Result of detecting and settling a payment for one invoice.
 *
 * Only SETTLED carries a {@link SettlementResult}; every other status means
 * nothing was written.
 */
@Value
public class ConfirmationOutcome {

    public enum Status {
        /** Matched and handed to the settlement poster. */
        SETTLED,
        /** No matching transfer yet; check again later. */
        NOT_FOUND,
        /** The mirror node has the transaction but it did not succeed (yet). */
        NOT_CONFIRMED,
        /** The transaction moved no funds of the token into the merchant account. */
        NO_TRANSFER,
        /** The received amount is outside the token's tolerance. */
        AMOUNT_MISMATCH
    }

    Status status;
    InboundLeg leg;
    PaymentValidation validation;
    SettlementResult settlement;
    int transactionsChecked;
    String detail;

    static ConfirmationOutcome settled(InboundLeg leg, PaymentValidation validation,
                                       SettlementResult settlement, int transactionsChecked) {
        return new ConfirmationOutcome(Status.SETTLED, leg, validation, settlement, transactionsChecked, null);
    }

    static ConfirmationOutcome notFound(int transactionsChecked, String detail) {
        return new ConfirmationOutcome(Status.NOT_FOUND, null, null, null, transactionsChecked, detail);
    }

    static ConfirmationOutcome rejected(Status status, InboundLeg leg, PaymentValidation validation, String detail) {
        return new ConfirmationOutcome(status, leg, validation, null, 0, detail);
    }

    public boolean isSettled() {
        return status == Status.SETTLED;
    }
}
