package com.sniper.backend.dto.offers;

import java.util.ArrayList;
import java.util.List;

import com.sniper.backend.dto.capacity.FinancialProfileRequest;
import com.sniper.backend.services.finance.model.Offer;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PurchaseAnalysisRequest {

    @Valid
    @NotNull(message = "Perfil financeiro é obrigatório")
    private FinancialProfileRequest profile;

    @Valid
    private List<OfferRequest> offers = new ArrayList<>();

    public List<Offer> toOffers() {
        return OfferRequests.toOffers(offers);
    }
}
