package com.sniper.backend.services.finance;

import java.math.BigDecimal;

import com.sniper.backend.exceptions.BadRequestException;

/**
 * Validações de fronteira: o motor só aceita valores monetários não negativos e
 * pelo menos uma parcela.
 */
public final class FinanceValidation {

    private FinanceValidation() {
    }

    public static BigDecimal requireNonNegative(BigDecimal value, String fieldLabel) {
        if (value == null) throw new BadRequestException(fieldLabel + " é obrigatório");
        if (value.signum() < 0) throw new BadRequestException(fieldLabel + " não pode ser negativo");
        return value;
    }

    public static BigDecimal nonNegativeOrZero(BigDecimal value, String fieldLabel) {
        return value == null ? BigDecimal.ZERO : requireNonNegative(value, fieldLabel);
    }

    public static int requireInstallmentCount(Integer count) {
        if (count == null) throw new BadRequestException("Número de parcelas é obrigatório");
        if (count < 1) throw new BadRequestException("Número de parcelas deve ser pelo menos 1");
        return count;
    }

    public static BigDecimal requirePercentage(BigDecimal value, String fieldLabel) {
        requireNonNegative(value, fieldLabel);
        if (value.compareTo(MoneyUtils.ONE_HUNDRED) > 0) {
            throw new BadRequestException(fieldLabel + " deve estar entre 0 e 100");
        }
        return value;
    }
}
