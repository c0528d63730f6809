package com.sniper.backend.dto.payment;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PaymentAnalysisRequest {

    @NotNull(message = "Preço à vista é obrigatório")
    @DecimalMin(value = "0.0", message = "Preço à vista não pode ser negativo")
    private BigDecimal cashPrice;

    @NotNull(message = "Preço parcelado é obrigatório")
    @DecimalMin(value = "0.0", message = "Preço parcelado não pode ser negativo")
    private BigDecimal installmentPrice;

    @NotNull(message = "Número de parcelas é obrigatório")
    @Min(value = 1, message = "Número de parcelas deve ser pelo menos 1")
    @Max(value = 360, message = "Número de parcelas deve ser no máximo 360")
    private Integer installmentCount;

    private Boolean interestFree;

    public boolean isInterestFreeOrDefault() {
        return interestFree == null || interestFree;
    }
}
