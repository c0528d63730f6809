package com.sniper.backend.dto.capacity;

import java.math.BigDecimal;

import com.sniper.backend.services.finance.model.FinancialProfile;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class FinancialProfileRequest {

    @NotNull(message = "Renda mensal é obrigatória")
    @DecimalMin(value = "0.0", message = "Renda mensal não pode ser negativa")
    private BigDecimal monthlyIncome;

    @NotNull(message = "Gastos fixos são obrigatórios")
    @DecimalMin(value = "0.0", message = "Gastos fixos não podem ser negativos")
    private BigDecimal fixedExpenses;

    /** Padrão 10%. */
    @DecimalMin(value = "0.0", message = "Margem de segurança deve estar entre 0 e 100")
    @DecimalMax(value = "100.0", message = "Margem de segurança deve estar entre 0 e 100")
    private BigDecimal safetyMarginPct;

    @DecimalMin(value = "0.0", message = "Compromissos atuais não podem ser negativos")
    private BigDecimal currentCommitments;

    public FinancialProfile toProfile() {
        return new FinancialProfile(monthlyIncome, fixedExpenses, safetyMarginPct, currentCommitments);
    }
}
