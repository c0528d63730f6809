package com.sniper.backend.services.finance;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.springframework.stereotype.Service;

import com.sniper.backend.config.FinanceEngineProperties;
import com.sniper.backend.enums.AffordabilityStrategy;
import com.sniper.backend.enums.Currency;
import com.sniper.backend.enums.RiskLevel;
import com.sniper.backend.services.finance.model.AffordabilityResult;
import com.sniper.backend.services.finance.model.FinancialProfile;
import com.sniper.backend.services.finance.rules.DecisionRule;
import com.sniper.backend.services.finance.rules.DecisionTable;

/**
 * Classifica se um item cabe no orçamento e como comprá-lo (estratégia + risco).
 *
 * Percentuais de comprometimento e meses para juntar usam o sentinela 999 quando
 * o fluxo livre ou o orçamento disponível não é positivo.
 */
@Service
public class AffordabilityClassifier {

    static final int MONTHS_SENTINEL = 999;

    private final DecisionTable<ItemContext, Verdict> classification;

    public AffordabilityClassifier(FinanceEngineProperties properties) {
        this.classification = DecisionTable.of("affordability",
                DecisionRule.when("cash-immediate",
                        c -> c.canAffordCash() && c.cashDiscountPct().compareTo(properties.cashDiscountThresholdPct()) >= 0,
                        c -> new Verdict(AffordabilityStrategy.CASH_IMMEDIATE,
                                "À vista imediato",
                                "Você tem fluxo de caixa e o desconto de " + MoneyUtils.formatPercent(c.cashDiscountPct())
                                        + " vale a pena. Economia de " + MoneyUtils.formatBrl(c.cashDiscount()) + ".",
                                RiskLevel.LOW)),
                DecisionRule.when("installment-safe",
                        c -> c.canAffordInstallment() && c.newCommitmentPct().compareTo(properties.safeCommitmentPct()) <= 0,
                        c -> new Verdict(AffordabilityStrategy.INSTALLMENT_SAFE,
                                "Parcelado em " + c.installmentCount() + "x",
                                "Parcela de " + MoneyUtils.formatBrl(c.monthlyInstallment()) + " compromete apenas "
                                        + MoneyUtils.formatPercent(c.installmentAsIncomePct()) + " da sua renda. Seguro.",
                                RiskLevel.LOW)),
                DecisionRule.when("installment-moderate",
                        c -> c.canAffordInstallment() && c.newCommitmentPct().compareTo(properties.maxCommitmentPct()) <= 0,
                        c -> new Verdict(AffordabilityStrategy.INSTALLMENT_MODERATE,
                                "Parcelado em " + c.installmentCount() + "x (atenção)",
                                "Parcela cabe no orçamento, mas você ficará com " + MoneyUtils.formatPercent(c.newCommitmentPct())
                                        + " comprometido. Considere esperar.",
                                RiskLevel.MEDIUM)),
                DecisionRule.when("installment-risky",
                        ItemContext::canAffordInstallment,
                        c -> new Verdict(AffordabilityStrategy.INSTALLMENT_RISKY,
                                "Parcelado em " + c.installmentCount() + "x (arriscado)",
                                "A parcela cabe, mas comprometeria " + MoneyUtils.formatPercent(c.newCommitmentPct())
                                        + " do seu fluxo livre. Alto risco financeiro.",
                                RiskLevel.HIGH)),
                DecisionRule.when("save-first",
                        c -> c.monthsToSaveCash() <= properties.saveFirstMaxMonths(),
                        c -> new Verdict(AffordabilityStrategy.SAVE_FIRST,
                                "Economizar por " + c.monthsToSaveCash() + " meses",
                                "Não cabe agora, mas economizando " + MoneyUtils.formatBrl(c.availableBudget())
                                        + "/mês você compra à vista em " + c.monthsToSaveCash() + " meses.",
                                RiskLevel.LOW)),
                DecisionRule.otherwise("not-affordable",
                        c -> new Verdict(AffordabilityStrategy.NOT_AFFORDABLE,
                                "Fora do orçamento atual",
                                "Este item está acima do seu poder de compra. "
                                        + "Considere uma alternativa mais barata ou aumente sua renda.",
                                RiskLevel.CRITICAL)));
    }

    public AffordabilityResult classify(FinancialProfile profile, BigDecimal itemCashPrice, BigDecimal itemInstallmentPrice, Integer installments) {
        BigDecimal cash = FinanceValidation.requireNonNegative(itemCashPrice, "Preço à vista");
        BigDecimal installmentTotal = itemInstallmentPrice == null
                ? cash
                : FinanceValidation.requireNonNegative(itemInstallmentPrice, "Preço parcelado");
        int count = FinanceValidation.requireInstallmentCount(installments);

        BigDecimal income = profile.monthlyIncome();
        BigDecimal commitments = profile.currentCommitments();
        BigDecimal freeCashFlow = CapacityCalculator.freeCashFlow(profile);
        BigDecimal availableBudget = freeCashFlow.subtract(commitments);
        BigDecimal monthly = installmentTotal.divide(BigDecimal.valueOf(count), MoneyUtils.MATH);

        BigDecimal cashDiscount = installmentTotal.subtract(cash);
        ItemContext context = new ItemContext(
                count,
                monthly,
                availableBudget,
                availableBudget.compareTo(cash) >= 0,
                availableBudget.compareTo(monthly) >= 0,
                MoneyUtils.percentageOf(commitments.add(monthly), freeCashFlow, MoneyUtils.PERCENT_SENTINEL),
                MoneyUtils.percentageOf(monthly, income, MoneyUtils.PERCENT_SENTINEL),
                cashDiscount,
                MoneyUtils.percentageOf(cashDiscount, installmentTotal, BigDecimal.ZERO),
                monthsToSave(cash, availableBudget));

        Verdict verdict = classification.evaluate(context);

        return AffordabilityResult.builder()
                .monthlyIncome(income)
                .fixedExpenses(profile.fixedExpenses())
                .freeCashFlow(MoneyUtils.money(freeCashFlow))
                .availableBudget(MoneyUtils.money(availableBudget))
                .currentCommitments(commitments)
                .itemPriceCash(cash)
                .itemPriceInstallment(installmentTotal)
                .installmentCount(count)
                .monthlyInstallment(MoneyUtils.money(monthly))
                .canAffordCash(context.canAffordCash())
                .canAffordInstallment(context.canAffordInstallment())
                .newCommitmentPct(MoneyUtils.percent(context.newCommitmentPct()))
                .installmentAsIncomePct(MoneyUtils.percent(context.installmentAsIncomePct()))
                .cashDiscount(MoneyUtils.money(cashDiscount))
                .cashDiscountPct(MoneyUtils.percent(context.cashDiscountPct()))
                .monthsToSaveCash(context.monthsToSaveCash())
                .recommendation(verdict.recommendation())
                .strategy(verdict.headline())
                .reason(verdict.reason())
                .riskLevel(verdict.riskLevel())
                .currency(Currency.BRL)
                .build();
    }

    /** Meses (arredondados para cima) juntando todo o orçamento disponível; 999 se não sobra nada. */
    static int monthsToSave(BigDecimal cashPrice, BigDecimal availableBudget) {
        if (availableBudget.signum() <= 0) {
            return MONTHS_SENTINEL;
        }
        BigDecimal months = cashPrice.divide(availableBudget, 0, RoundingMode.CEILING);
        return months.min(BigDecimal.valueOf(MONTHS_SENTINEL)).intValue();
    }

    private record ItemContext(
            int installmentCount,
            BigDecimal monthlyInstallment,
            BigDecimal availableBudget,
            boolean canAffordCash,
            boolean canAffordInstallment,
            BigDecimal newCommitmentPct,
            BigDecimal installmentAsIncomePct,
            BigDecimal cashDiscount,
            BigDecimal cashDiscountPct,
            int monthsToSaveCash
    ) {
    }

    private record Verdict(
            AffordabilityStrategy recommendation,
            String headline,
            String reason,
            RiskLevel riskLevel
    ) {
    }
}
