package com.sniper.backend.dto.offers;

import java.util.List;

import com.sniper.backend.services.finance.model.Offer;

final class OfferRequests {

    private OfferRequests() {
    }

    static List<Offer> toOffers(List<OfferRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream().map(OfferRequest::toOffer).toList();
    }
}
