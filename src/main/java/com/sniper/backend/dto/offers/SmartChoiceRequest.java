package com.sniper.backend.dto.offers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.sniper.backend.services.finance.model.Offer;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SmartChoiceRequest {

    @NotNull(message = "Caixa disponível é obrigatório")
    private BigDecimal availableCash;

    @NotNull(message = "Capacidade mensal é obrigatória")
    private BigDecimal monthlyCapacity;

    @Valid
    private List<OfferRequest> offers = new ArrayList<>();

    public List<Offer> toOffers() {
        return OfferRequests.toOffers(offers);
    }
}
