package com.sniper.backend.services.finance;

import java.math.BigDecimal;

import com.sniper.backend.services.finance.model.Offer;

/**
 * Números de uma oferta frente ao orçamento do usuário, em precisão cheia.
 * É o contexto comum às regras de score e de recomendação.
 */
public record OfferEvaluation(
        Offer offer,
        BigDecimal monthlyInstallment,
        boolean canAffordCash,
        boolean canAffordInstallment,
        BigDecimal cashDiscount,
        BigDecimal cashDiscountPct,
        BigDecimal commitmentPct
) {
    public boolean interestFree() {
        return offer.interestFree();
    }

    public int installmentCount() {
        return offer.installmentCount();
    }
}
