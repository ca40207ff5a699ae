package com.flagship.crypto_settlement.hedera;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Amount conversions must be exact: no rounding, no binary floating point.
 */
class AmountCodecTest {

    @Nested
    @DisplayName("1. Text to smallest units")
    class ToSmallestUnit {

        @Test
        @DisplayName("Stablecoin amount with six decimals converts exactly")
        void testStablecoinAmount_Exact() {
            assertEquals(new BigInteger("15046618"), AmountCodec.toSmallestUnit("15.046618", 6));
        }

        @Test
        @DisplayName("Short fraction is right-padded")
        void testShortFraction_Padded() {
            assertEquals(new BigInteger("1500000"), AmountCodec.toSmallestUnit("1.5", 6));
            assertEquals(new BigInteger("100000000"), AmountCodec.toSmallestUnit("1", 8));
        }

        @Test
        @DisplayName("Value that is inexact in binary floating point stays exact")
        void testBinaryInexactValue_Exact() {
            assertEquals(new BigInteger("10000000"), AmountCodec.toSmallestUnit("0.1", 8));
            assertEquals(new BigInteger("10000000"), AmountCodec.toSmallestUnit(0.1d, 8));
            assertEquals(new BigInteger("30000000"), AmountCodec.toSmallestUnit(0.3d, 8));
        }

        @Test
        @DisplayName("Amounts beyond the long range are supported")
        void testHugeAmount_Supported() {
            assertEquals(new BigInteger("123456789012345678901234567890000000000000000000"),
                AmountCodec.toSmallestUnit("123456789012345678901234567890", 18));
        }

        @Test
        @DisplayName("Surrounding whitespace is ignored")
        void testWhitespace_Trimmed() {
            assertEquals(new BigInteger("250"), AmountCodec.toSmallestUnit(" 2.5 ", 2));
        }

        @Test
        @DisplayName("Too many fraction digits is rejected rather than rounded")
        void testTooManyDecimals_Rejected() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> AmountCodec.toSmallestUnit("1.0000001", 6));
            assertTrue(e.getMessage().contains("too many decimal places"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "1e5", "1E-3", "abc", "1.", ".5", "1.2.3", "1,5"})
        @DisplayName("Malformed input is rejected")
        void testMalformed_Rejected(String amount) {
            assertThrows(IllegalArgumentException.class, () -> AmountCodec.toSmallestUnit(amount, 6));
        }

        @Test
        @DisplayName("Negative amounts are rejected in every overload")
        void testNegative_Rejected() {
            assertThrows(IllegalArgumentException.class, () -> AmountCodec.toSmallestUnit("-1", 6));
            assertThrows(IllegalArgumentException.class, () -> AmountCodec.toSmallestUnit(new BigDecimal("-1"), 6));
            assertThrows(IllegalArgumentException.class, () -> AmountCodec.toSmallestUnit(-1d, 6));
        }

        @Test
        @DisplayName("Non-finite doubles are rejected")
        void testNonFinite_Rejected() {
            assertThrows(IllegalArgumentException.class, () -> AmountCodec.toSmallestUnit(Double.NaN, 6));
            assertThrows(IllegalArgumentException.class,
                () -> AmountCodec.toSmallestUnit(Double.POSITIVE_INFINITY, 6));
        }

        @Test
        @DisplayName("Decimals outside 0..18 are rejected")
        void testDecimalsOutOfRange_Rejected() {
            assertThrows(IllegalArgumentException.class, () -> AmountCodec.toSmallestUnit("1", -1));
            assertThrows(IllegalArgumentException.class, () -> AmountCodec.toSmallestUnit("1", 19));
        }

        @Test
        @DisplayName("BigDecimal with trailing zeros beyond the scale is accepted")
        void testBigDecimalTrailingZeros_Accepted() {
            assertEquals(new BigInteger("50000000"), AmountCodec.toSmallestUnit(new BigDecimal("50.0000000000"), 6));
        }
    }

    @Nested
    @DisplayName("2. Smallest units to amounts")
    class FromSmallestUnit {

        @Test
        @DisplayName("Result carries the asset scale")
        void testScale_Preserved() {
            assertEquals("1.500000", AmountCodec.fromSmallestUnit(1_500_000L, 6).toPlainString());
            assertEquals("0.00000001", AmountCodec.fromSmallestUnit(1L, 8).toPlainString());
        }

        @Test
        @DisplayName("Zero is formatted with full precision")
        void testZero_Formatted() {
            assertEquals("0.00000000", AmountCodec.zero(8));
            assertEquals("0.000000", AmountCodec.zero(6));
            assertEquals("0", AmountCodec.zero(0));
        }

        @Test
        @DisplayName("Negative or null units are rejected")
        void testInvalidUnits_Rejected() {
            assertThrows(IllegalArgumentException.class, () -> AmountCodec.fromSmallestUnit(-5L, 6));
            assertThrows(IllegalArgumentException.class, () -> AmountCodec.fromSmallestUnit(null, 6));
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 2, 6, 8, 12, 18})
        @DisplayName("Text to units and back gives the same value at every precision")
        void testRoundTrip_AllPrecisions(int decimals) {
            String amount = decimals == 0 ? "987654321" : "987654321." + "123456789012345678".substring(0, decimals);
            BigInteger units = AmountCodec.toSmallestUnit(amount, decimals);
            assertEquals(amount, AmountCodec.format(units, decimals));
        }
    }

    @Test
    @DisplayName("parseAmount validates and rescales")
    void testParseAmount() {
        assertEquals(new BigDecimal("50.000000"), AmountCodec.parseAmount("50", 6));
        assertThrows(IllegalArgumentException.class, () -> AmountCodec.parseAmount("50.1234567", 6));
    }
}
