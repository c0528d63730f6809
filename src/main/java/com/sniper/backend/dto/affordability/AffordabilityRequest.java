package com.sniper.backend.dto.affordability;

import java.math.BigDecimal;

import com.sniper.backend.dto.capacity.FinancialProfileRequest;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class AffordabilityRequest {

    @Valid
    @NotNull(message = "Perfil financeiro é obrigatório")
    private FinancialProfileRequest profile;

    @NotNull(message = "Preço à vista é obrigatório")
    @DecimalMin(value = "0.0", message = "Preço à vista não pode ser negativo")
    private BigDecimal itemCashPrice;

    /** Ausente = mesmo valor do preço à vista. */
    @DecimalMin(value = "0.0", message = "Preço parcelado não pode ser negativo")
    private BigDecimal itemInstallmentPrice;

    @NotNull(message = "Número de parcelas é obrigatório")
    @Min(value = 1, message = "Número de parcelas deve ser pelo menos 1")
    @Max(value = 360, message = "Número de parcelas deve ser no máximo 360")
    private Integer installmentCount;
}
