package com.sniper.backend.services.finance;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;

import com.sniper.backend.config.FinanceEngineProperties;
import com.sniper.backend.enums.Currency;
import com.sniper.backend.services.finance.model.CapacitySnapshot;
import com.sniper.backend.services.finance.model.FinancialProfile;

import lombok.RequiredArgsConstructor;

/**
 * Capacidade de pagamento: quanto do fluxo livre pode virar parcela nova.
 *
 * <pre>
 * margem         = renda * margem% / 100
 * fluxo livre    = renda - gastos fixos - margem
 * disponível     = fluxo livre - compromissos atuais
 * capacidade     = fluxo livre * 30% (segura) / 50% (máxima)
 * </pre>
 *
 * Não há condição de erro: valores negativos indicam perfil comprometido e são repassados
 * adiante. Nada é cacheado; cada chamada recalcula a partir do perfil recebido.
 */
@Component
@RequiredArgsConstructor
public class CapacityCalculator {

    private final FinanceEngineProperties properties;

    public CapacitySnapshot calculate(FinancialProfile profile) {
        BigDecimal safetyMargin = safetyMarginValue(profile);
        BigDecimal freeCashFlow = freeCashFlow(profile);
        BigDecimal commitments = profile.currentCommitments();

        return CapacitySnapshot.builder()
                .monthlyIncome(profile.monthlyIncome())
                .fixedExpenses(profile.fixedExpenses())
                .safetyMarginPct(profile.safetyMarginPct())
                .safetyMargin(safetyMargin)
                .freeCashFlow(freeCashFlow)
                .currentCommitments(commitments)
                .availableForNew(freeCashFlow.subtract(commitments))
                .safeInstallmentCapacity(MoneyUtils.percentOf(freeCashFlow, properties.safeCommitmentPct()))
                .maxInstallmentCapacity(MoneyUtils.percentOf(freeCashFlow, properties.maxCommitmentPct()))
                .commitmentPercentage(MoneyUtils.percent(
                        MoneyUtils.percentageOf(commitments, freeCashFlow, BigDecimal.ZERO)))
                .overCommitted(commitments.compareTo(freeCashFlow) > 0)
                .currency(Currency.BRL)
                .build();
    }

    public static BigDecimal safetyMarginValue(FinancialProfile profile) {
        return MoneyUtils.percentOf(profile.monthlyIncome(), profile.safetyMarginPct());
    }

    public static BigDecimal freeCashFlow(FinancialProfile profile) {
        return profile.monthlyIncome()
                .subtract(profile.fixedExpenses())
                .subtract(safetyMarginValue(profile));
    }

    /** Fluxo livre menos compromissos atuais; negativo quando o perfil está sobrecomprometido. */
    public static BigDecimal availableCash(FinancialProfile profile) {
        return freeCashFlow(profile).subtract(profile.currentCommitments());
    }
}
