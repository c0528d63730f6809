package com.sniper.backend.services.finance;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import com.sniper.backend.exceptions.BadRequestException;

/**
 * Parsing, arredondamento e formatação de valores monetários (BRL/USD).
 *
 * Toda a aritmética interna usa {@link #MATH} (DECIMAL128); o arredondamento HALF_UP
 * acontece só na saída, via {@link #money(BigDecimal)} e {@link #percent(BigDecimal)}.
 */
public final class MoneyUtils {

    public static final Locale LOCALE_PT_BR = new Locale("pt", "BR");

    public static final MathContext MATH = MathContext.DECIMAL128;

    public static final int MONEY_SCALE = 2;
    public static final int PERCENT_SCALE = 1;

    public static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    /** Percentual "infinitamente acima do orçamento" quando o divisor é zero ou negativo. */
    public static final BigDecimal PERCENT_SENTINEL = new BigDecimal("999");

    private static final Pattern CURRENCY_MARKS = Pattern.compile("[R$US\\s]");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.]");

    private MoneyUtils() {
    }

    public static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static BigDecimal money(BigDecimal value) {
        return nz(value).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal percent(BigDecimal value) {
        return nz(value).setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * part / total * 100 em precisão cheia; devolve {@code whenZero} quando total <= 0.
     */
    public static BigDecimal percentageOf(BigDecimal part, BigDecimal total, BigDecimal whenZero) {
        if (total == null || total.signum() <= 0) {
            return whenZero;
        }
        return nz(part).multiply(ONE_HUNDRED).divide(total, MATH);
    }

    /**
     * value * pct / 100, exato (sem divisão com arredondamento).
     */
    public static BigDecimal percentOf(BigDecimal value, BigDecimal pct) {
        return nz(value).multiply(nz(pct)).movePointLeft(2);
    }

    /**
     * Extrai o valor numérico de uma string de preço.
     *
     * "R$ 1.299,00" -> 1299.00, "US$ 49.99" -> 49.99, "1299.99" -> 1299.99.
     * Vírgula seguida de exatamente dois dígitos é tratada como separador decimal.
     */
    public static Optional<BigDecimal> parsePrice(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        String cleaned = CURRENCY_MARKS.matcher(raw).replaceAll("");

        boolean hasComma = cleaned.contains(",");
        boolean hasDot = cleaned.contains(".");
        if (hasComma && hasDot) {
            if (cleaned.lastIndexOf(',') > cleaned.lastIndexOf('.')) {
                cleaned = cleaned.replace(".", "").replace(',', '.');
            } else {
                cleaned = cleaned.replace(",", "");
            }
        } else if (hasComma) {
            String[] parts = cleaned.split(",", -1);
            if (parts.length == 2 && parts[1].length() == 2) {
                cleaned = cleaned.replace(',', '.');
            } else {
                cleaned = cleaned.replace(",", "");
            }
        }

        cleaned = NON_NUMERIC.matcher(cleaned).replaceAll("");
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static BigDecimal parsePriceOrThrow(String raw) {
        return parsePrice(raw)
                .orElseThrow(() -> new BadRequestException("Preço inválido: " + raw));
    }

    public static String formatBrl(BigDecimal value) {
        return "R$ " + brlFormat(MONEY_SCALE).format(money(value));
    }

    public static String formatUsd(BigDecimal value) {
        DecimalFormat df = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        df.setRoundingMode(RoundingMode.HALF_UP);
        return "US$ " + df.format(money(value));
    }

    /** Cotação com quatro casas: "R$ 5,5000". */
    public static String formatRate(BigDecimal rate) {
        return "R$ " + brlFormat(4).format(nz(rate).setScale(4, RoundingMode.HALF_UP));
    }

    /** "10,0%" */
    public static String formatPercent(BigDecimal value) {
        DecimalFormat df = new DecimalFormat("0.0", DecimalFormatSymbols.getInstance(LOCALE_PT_BR));
        df.setRoundingMode(RoundingMode.HALF_UP);
        return df.format(percent(value)) + "%";
    }

    /** "34%" */
    public static String formatWholePercent(BigDecimal value) {
        return nz(value).setScale(0, RoundingMode.HALF_UP).toPlainString() + "%";
    }

    private static DecimalFormat brlFormat(int decimals) {
        StringBuilder pattern = new StringBuilder("#,##0.");
        for (int i = 0; i < decimals; i++) {
            pattern.append('0');
        }
        DecimalFormat df = new DecimalFormat(pattern.toString(), DecimalFormatSymbols.getInstance(LOCALE_PT_BR));
        df.setRoundingMode(RoundingMode.HALF_UP);
        return df;
    }
}
