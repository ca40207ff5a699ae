package com.flagship.crypto_settlement.wallet.request;

import com.flagship.crypto_settlement.wallet.WalletResponse;
import lombok.Value;

/**
 * Outcome of a wallet-approved payment. {@code transactionId} is the id the
 * wallet reported in dash form, or the locally generated id when the wallet
 * returned none.
 */
@Value
public class PaymentSubmission {
    String transactionId;
    String memo;
    WalletResponse.Shape responseShape;

    public boolean isReportedByWallet() {
        return responseShape != WalletResponse.Shape.NO_TRANSACTION_ID;
    }
}
