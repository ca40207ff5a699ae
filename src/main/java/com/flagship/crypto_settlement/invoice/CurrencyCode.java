package com.flagship.crypto_settlement.invoice;

/**
 * ISO-4217 invoice currencies.
 *
 * Invoices are priced in fiat; the crypto amount due is derived elsewhere.
 * Ledger entries are written in the invoice currency.
 */
public enum CurrencyCode {
    USD, // US Dollar
    AUD, // Australian Dollar
    EUR, // Euro
    GBP, // British Pound
    NZD, // New Zealand Dollar
    CAD, // Canadian Dollar
    SGD, // Singapore Dollar
}
