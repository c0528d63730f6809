package com.sniper.backend.dto.payment;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class InstallmentSuggestionRequest {

    @NotNull(message = "Preço do item é obrigatório")
    @DecimalMin(value = "0.0", message = "Preço do item não pode ser negativo")
    private BigDecimal itemPrice;

    @NotNull(message = "Orçamento mensal é obrigatório")
    private BigDecimal monthlyBudget;

    @Min(value = 1, message = "Máximo de parcelas deve ser pelo menos 1")
    @Max(value = 360, message = "Máximo de parcelas deve ser no máximo 360")
    private Integer maxInstallments;
}
