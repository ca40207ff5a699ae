package com.flagship.crypto_settlement.mirror;

import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

/**
 * A transaction as reported by the mirror node REST API
 * ({@code /api/v1/transactions}).
 *
 * The transaction id is in the mirror node's dash format.
 */
@Value
public class MirrorTransaction {

    private static final String RESULT_SUCCESS = "SUCCESS";

    String transactionId;
    String consensusTimestamp;
    long chargedTxFee;
    String memoBase64;
    String result;
    String name;
    List<MirrorTransfer> transfers;
    List<MirrorTokenTransfer> tokenTransfers;

    /**
     * Memo as UTF-8 text; empty when absent or not valid base64.
     */
    public String decodedMemo() {
        if (memoBase64 == null || memoBase64.isEmpty()) {
            return "";
        }
        try {
            return new String(Base64.getDecoder().decode(memoBase64), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    public boolean hasMemo() {
        return memoBase64 != null && !memoBase64.isEmpty();
    }

    /**
     * A transaction is final once it reached consensus with result SUCCESS.
     */
    public boolean isConfirmed() {
        return RESULT_SUCCESS.equals(result) && consensusTimestamp != null && !consensusTimestamp.isEmpty();
    }
}
