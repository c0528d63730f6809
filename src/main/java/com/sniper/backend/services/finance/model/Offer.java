package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import com.sniper.backend.services.finance.FinanceValidation;
import com.sniper.backend.services.finance.MoneyUtils;

import lombok.Builder;

/**
 * Oferta de uma loja: preço à vista, preço parcelado e condições do parcelamento.
 */
@Builder
public record Offer(
        String store,
        BigDecimal cashPrice,
        BigDecimal installmentPrice,
        int installmentCount,
        boolean interestFree,
        String url
) {
    public static final String UNKNOWN_STORE = "Desconhecida";

    public Offer {
        store = (store == null || store.isBlank()) ? UNKNOWN_STORE : store.trim();
        FinanceValidation.requireNonNegative(cashPrice, "Preço à vista");
        installmentPrice = installmentPrice == null
                ? cashPrice
                : FinanceValidation.requireNonNegative(installmentPrice, "Preço parcelado");
        FinanceValidation.requireInstallmentCount(installmentCount);
        url = url == null ? "" : url;
    }

    public static Offer of(String store, BigDecimal cashPrice, BigDecimal installmentPrice, int installmentCount, boolean interestFree) {
        return new Offer(store, cashPrice, installmentPrice, installmentCount, interestFree, null);
    }

    public BigDecimal monthlyInstallment() {
        return installmentPrice.divide(BigDecimal.valueOf(installmentCount), MoneyUtils.MATH);
    }
}
