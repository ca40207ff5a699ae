package com.flagship.crypto_settlement.api;

import com.flagship.crypto_settlement.api.dto.ConfirmPaymentRequest;
import com.flagship.crypto_settlement.api.dto.LedgerRetryResponse;
import com.flagship.crypto_settlement.api.dto.ToleranceResponse;
import com.flagship.crypto_settlement.api.dto.TransactionCheckRequest;
import com.flagship.crypto_settlement.api.dto.TransactionCheckResponse;
import com.flagship.crypto_settlement.hedera.AmountCodec;
import com.flagship.crypto_settlement.hedera.HederaToken;
import com.flagship.crypto_settlement.matcher.MatchCriteria;
import com.flagship.crypto_settlement.observability.RequestIdContext;
import com.flagship.crypto_settlement.settlement.ConfirmationOutcome;
import com.flagship.crypto_settlement.settlement.LedgerRetryResult;
import com.flagship.crypto_settlement.settlement.PaymentConfirmationService;
import com.flagship.crypto_settlement.settlement.SettlementPoster;
import com.flagship.crypto_settlement.validation.AcceptableRange;
import com.flagship.crypto_settlement.validation.PaymentValidator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;

/**
 * HTTP entry points for payment detection and settlement.
 *
 * Not-found and amount-mismatch are ordinary 200 responses; clients poll
 * {@code /transactions/check} on their own schedule. Lock contention and
 * closed invoices map to 409 in {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/hedera")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final PaymentConfirmationService confirmationService;
    private final SettlementPoster settlementPoster;
    private final PaymentValidator paymentValidator;

    @Value("${matcher.default-window-minutes:15}")
    private long defaultWindowMinutes;

    @PostMapping("/transactions/check")
    public ResponseEntity<TransactionCheckResponse> checkTransaction(@Valid @RequestBody TransactionCheckRequest request) {
        MDC.put(RequestIdContext.INVOICE_ID_MDC_KEY, request.getInvoiceId().toString());
        try {
            log.info("Checking for payment: merchant={}, token={}, expectedAmount={}",
                request.getMerchantAccountId(), request.getToken(), request.getExpectedAmount());

            Duration window = Duration.ofMinutes(request.getTimeWindowMinutes() == null
                ? defaultWindowMinutes
                : request.getTimeWindowMinutes());
            MatchCriteria criteria = MatchCriteria.of(request.getMerchantAccountId(), request.getToken(),
                request.getExpectedAmount(), request.getPayerAccountId(), request.getMemo(), window);

            ConfirmationOutcome outcome = confirmationService.checkAndSettle(request.getInvoiceId(), criteria);
            return ResponseEntity.ok(TransactionCheckResponse.from(outcome));
        } finally {
            MDC.remove(RequestIdContext.INVOICE_ID_MDC_KEY);
        }
    }

    @PostMapping("/confirm")
    public ResponseEntity<TransactionCheckResponse> confirm(@Valid @RequestBody ConfirmPaymentRequest request) {
        MDC.put(RequestIdContext.INVOICE_ID_MDC_KEY, request.getInvoiceId().toString());
        try {
            ConfirmationOutcome outcome = confirmationService.confirmTransaction(
                request.getInvoiceId(), request.getTransactionId(), request.getToken(),
                request.getMerchantAccountId(), request.getExpectedAmount());
            return ResponseEntity.ok(TransactionCheckResponse.from(outcome));
        } finally {
            MDC.remove(RequestIdContext.INVOICE_ID_MDC_KEY);
        }
    }

    @PostMapping("/ledger/{invoiceId}/retry")
    public ResponseEntity<LedgerRetryResponse> retryLedgerPosting(@PathVariable("invoiceId") UUID invoiceId) {
        LedgerRetryResult result = settlementPoster.retryLedgerPosting(invoiceId);
        return ResponseEntity.ok(LedgerRetryResponse.from(result));
    }

    /**
     * Accepted band for paying {@code amount} in {@code token}.
     */
    @GetMapping("/tolerance/{token}")
    public ResponseEntity<ToleranceResponse> tolerance(@PathVariable("token") String token,
                                                       @RequestParam("amount") String amount) {
        HederaToken hederaToken = parseToken(token);
        BigDecimal required = AmountCodec.parseAmount(amount, hederaToken.getDecimals());
        if (required.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be greater than 0");
        }
        AcceptableRange range = paymentValidator.acceptableRange(required, hederaToken);
        return ResponseEntity.ok(new ToleranceResponse(hederaToken, required,
            range.getMin(), range.getMax(), range.getTolerancePercent()));
    }

    private static HederaToken parseToken(String token) {
        try {
            return HederaToken.valueOf(token.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported token: " + token, e);
        }
    }
}
