package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;
import java.util.List;

import com.sniper.backend.enums.Currency;

/**
 * Resultado do Smart Choice. Sem ofertas, {@code error} vem preenchido e não há recomendação.
 */
public record RankingResult(
        ScoredOffer bestOption,
        List<ScoredOffer> allOptions,
        Recommendation recommendation,
        BigDecimal userAvailableCash,
        BigDecimal userMonthlyCapacity,
        String error,
        Currency currency
) {
    public static final String NO_OFFERS_MESSAGE = "Nenhuma opção de loja fornecida";

    public RankingResult {
        allOptions = allOptions == null ? List.of() : List.copyOf(allOptions);
    }

    public static RankingResult noOffers(BigDecimal availableCash, BigDecimal monthlyCapacity) {
        return new RankingResult(null, List.of(), null, availableCash, monthlyCapacity, NO_OFFERS_MESSAGE, Currency.BRL);
    }

    public boolean hasOffers() {
        return error == null && !allOptions.isEmpty();
    }
}
