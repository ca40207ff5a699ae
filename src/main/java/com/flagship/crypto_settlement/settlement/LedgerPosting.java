package com.flagship.crypto_settlement.settlement;

import lombok.Value;

/**
 * Whether the ledger step of a settlement succeeded.
 */
@Value
class LedgerPosting {
    boolean posted;
    boolean alreadyPosted;
    String error;

    static LedgerPosting posted(boolean alreadyPosted) {
        return new LedgerPosting(true, alreadyPosted, null);
    }

    static LedgerPosting failed(String error) {
        return new LedgerPosting(false, false, error);
    }
}
