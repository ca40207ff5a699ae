package com.flagship.crypto_settlement.wallet.request;

import com.flagship.crypto_settlement.hedera.HederaToken;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * What the payer is asked to send: {@code amount} of {@code token} to the
 * merchant, tagged with a memo the matcher later looks for.
 */
@Value
public class PaymentRequest {

    /** Hedera transaction memos are limited to 100 bytes. */
    public static final int MAX_MEMO_BYTES = 100;

    private static final Pattern ACCOUNT_ID = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    HederaToken token;
    String merchantAccountId;
    String amount;
    String memo;

    public PaymentRequest(HederaToken token, String merchantAccountId, String amount, String memo) {
        if (token == null) {
            throw new IllegalArgumentException("Token is required");
        }
        if (merchantAccountId == null || !ACCOUNT_ID.matcher(merchantAccountId).matches()) {
            throw new IllegalArgumentException("Invalid merchant account id: " + merchantAccountId);
        }
        if (memo != null && memo.getBytes(StandardCharsets.UTF_8).length > MAX_MEMO_BYTES) {
            throw new IllegalArgumentException("Memo exceeds " + MAX_MEMO_BYTES + " bytes");
        }
        this.token = token;
        this.merchantAccountId = merchantAccountId;
        this.amount = amount;
        this.memo = memo == null ? "" : memo;
    }
}
