package com.sniper.backend.dto.offers;

import java.math.BigDecimal;

import com.sniper.backend.services.finance.model.Offer;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class OfferRequest {

    private String store;

    @NotNull(message = "Preço à vista é obrigatório")
    @DecimalMin(value = "0.0", message = "Preço à vista não pode ser negativo")
    private BigDecimal cashPrice;

    @DecimalMin(value = "0.0", message = "Preço parcelado não pode ser negativo")
    private BigDecimal installmentPrice;

    @Min(value = 1, message = "Número de parcelas deve ser pelo menos 1")
    @Max(value = 360, message = "Número de parcelas deve ser no máximo 360")
    private Integer installmentCount;

    private Boolean interestFree;

    private String url;

    public Offer toOffer() {
        return new Offer(
                store,
                cashPrice,
                installmentPrice,
                installmentCount == null ? 1 : installmentCount,
                interestFree == null || interestFree,
                url);
    }
}
