package com.sniper.backend.dto.payment;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class InstallmentPlanRequest {

    @NotNull(message = "Preço total é obrigatório")
    @DecimalMin(value = "0.0", message = "Preço total não pode ser negativo")
    private BigDecimal totalPrice;

    @NotNull(message = "Número de parcelas é obrigatório")
    @Min(value = 1, message = "Número de parcelas deve ser pelo menos 1")
    @Max(value = 360, message = "Número de parcelas deve ser no máximo 360")
    private Integer installmentCount;

    /** Fração ao mês, ex: 0.0199 para 1,99% a.m. Ausente = sem juros. */
    @DecimalMin(value = "0.0", message = "Taxa de juros não pode ser negativa")
    private BigDecimal monthlyInterestRate;
}
