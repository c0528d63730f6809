package com.sniper.backend.services.finance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.sniper.backend.exceptions.BadRequestException;

class MoneyUtilsTest {

    @Test
    void parsePrice_brazilianFormat_usesCommaAsDecimalSeparator() {
        assertEquals(0, new BigDecimal("1299.00").compareTo(MoneyUtils.parsePrice("R$ 1.299,00").orElseThrow()));
        assertEquals(0, new BigDecimal("1299.9").compareTo(MoneyUtils.parsePrice("1.299,9").orElseThrow()));
    }

    @Test
    void parsePrice_dollarAndPlainFormats_keepDot() {
        assertEquals(0, new BigDecimal("49.99").compareTo(MoneyUtils.parsePrice("US$ 49.99").orElseThrow()));
        assertEquals(0, new BigDecimal("1299.99").compareTo(MoneyUtils.parsePrice("1299.99").orElseThrow()));
    }

    @Test
    void parsePrice_blankOrGarbage_returnsEmpty() {
        assertEquals(Optional.empty(), MoneyUtils.parsePrice(null));
        assertEquals(Optional.empty(), MoneyUtils.parsePrice("   "));
        assertEquals(Optional.empty(), MoneyUtils.parsePrice("abc"));
    }

    @Test
    void parsePriceOrThrow_garbage_throwsBadRequest() {
        BadRequestException ex = assertThrows(BadRequestException.class, () -> MoneyUtils.parsePriceOrThrow("xyz"));
        assertTrue(ex.getMessage().startsWith("Preço inválido"));
    }

    @Test
    void money_roundsHalfUpToTwoPlaces() {
        assertEquals(new BigDecimal("1.01"), MoneyUtils.money(new BigDecimal("1.005")));
        assertEquals(new BigDecimal("2.00"), MoneyUtils.money(new BigDecimal("1.995")));
        assertEquals(new BigDecimal("0.00"), MoneyUtils.money(null));
    }

    @Test
    void formatting_usesBrazilianSeparatorsForBrl() {
        assertEquals("R$ 1.299,50", MoneyUtils.formatBrl(new BigDecimal("1299.5")));
        assertEquals("US$ 49.99", MoneyUtils.formatUsd(new BigDecimal("49.99")));
        assertEquals("10,0%", MoneyUtils.formatPercent(BigDecimal.TEN));
        assertEquals("R$ 5,5000", MoneyUtils.formatRate(new BigDecimal("5.5")));
        assertEquals("50%", MoneyUtils.formatWholePercent(new BigDecimal("49.5")));
    }

    @Test
    void percentageOf_nonPositiveTotal_returnsFallbackValue() {
        assertEquals(MoneyUtils.PERCENT_SENTINEL,
                MoneyUtils.percentageOf(BigDecimal.TEN, BigDecimal.ZERO, MoneyUtils.PERCENT_SENTINEL));
        assertEquals(0, new BigDecimal("25").compareTo(
                MoneyUtils.percentageOf(new BigDecimal("50"), new BigDecimal("200"), BigDecimal.ZERO)));
    }
}
