package com.sniper.backend.services.finance;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.springframework.stereotype.Service;

import com.sniper.backend.config.FinanceEngineProperties;
import com.sniper.backend.enums.Currency;
import com.sniper.backend.exceptions.BadRequestException;
import com.sniper.backend.services.finance.model.InstallmentPlan;
import com.sniper.backend.services.finance.model.InstallmentSuggestion;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class InstallmentPlanner {

    static final String NO_BUDGET = "Sem orçamento disponível";

    private static final BigDecimal MAX_COUNT = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final FinanceEngineProperties properties;

    /**
     * Parcela pela Tabela Price: {@code PV * i(1+i)^n / ((1+i)^n - 1)}.
     * Taxa zero divide o total igualmente e não gera juros.
     *
     * @param monthlyRate taxa mensal como fração (0.0199 = 1,99% a.m.)
     */
    public InstallmentPlan plan(BigDecimal totalPrice, Integer installments, BigDecimal monthlyRate) {
        BigDecimal total = FinanceValidation.requireNonNegative(totalPrice, "Preço total");
        int count = FinanceValidation.requireInstallmentCount(installments);
        BigDecimal rate = monthlyRate == null ? BigDecimal.ZERO : monthlyRate;
        if (rate.signum() < 0) {
            throw new BadRequestException("Taxa de juros não pode ser negativa");
        }

        BigDecimal installment;
        BigDecimal totalWithInterest;
        if (rate.signum() > 0) {
            BigDecimal growth = BigDecimal.ONE.add(rate).pow(count, MoneyUtils.MATH);
            installment = total.multiply(rate.multiply(growth))
                    .divide(growth.subtract(BigDecimal.ONE), MoneyUtils.MATH);
            totalWithInterest = installment.multiply(BigDecimal.valueOf(count));
        } else {
            installment = total.divide(BigDecimal.valueOf(count), MoneyUtils.MATH);
            totalWithInterest = total;
        }

        return InstallmentPlan.builder()
                .originalPrice(total)
                .numInstallments(count)
                .interestRateMonthlyPct(rate.multiply(MoneyUtils.ONE_HUNDRED).stripTrailingZeros())
                .installmentValue(MoneyUtils.money(installment))
                .totalWithInterest(MoneyUtils.money(totalWithInterest))
                .interestPaid(MoneyUtils.money(totalWithInterest.subtract(total)))
                .interestFree(rate.signum() == 0)
                .currency(Currency.BRL)
                .build();
    }

    /**
     * Sugere quantas parcelas um item precisa para caber no orçamento mensal.
     * "Confortável" é a contagem em que a parcela ocupa só uma fração (30%) do orçamento.
     */
    public InstallmentSuggestion suggest(BigDecimal itemPrice, BigDecimal monthlyBudget, Integer maxInstallments) {
        BigDecimal price = FinanceValidation.requireNonNegative(itemPrice, "Preço do item");
        BigDecimal budget = MoneyUtils.nz(monthlyBudget);
        int max = maxInstallments == null
                ? properties.maxSuggestedInstallments()
                : FinanceValidation.requireInstallmentCount(maxInstallments);

        if (budget.signum() <= 0) {
            return InstallmentSuggestion.builder()
                    .suggestion(NO_BUDGET)
                    .itemPrice(price)
                    .userBudget(budget)
                    .build();
        }

        int minimum = Math.max(1, roundedCount(price, budget));
        int comfortable = Math.max(1, roundedCount(price, budget.multiply(properties.comfortablePaymentShare())));
        int cappedComfortable = Math.min(comfortable, max);

        String suggestion;
        if (minimum > max) {
            suggestion = String.format("Este item está acima do seu orçamento. Precisaria de %dx mas o máximo comum é %dx.",
                    minimum, max);
        } else if (comfortable <= properties.idealInstallmentCount()) {
            BigDecimal payment = price.divide(BigDecimal.valueOf(comfortable), MoneyUtils.MATH);
            suggestion = String.format("Ideal: %dx (parcela confortável de %s)", comfortable, MoneyUtils.formatBrl(payment));
        } else {
            suggestion = String.format("Mínimo: %dx | Confortável: %dx", minimum, cappedComfortable);
        }

        return InstallmentSuggestion.builder()
                .suggestion(suggestion)
                .minInstallments(minimum)
                .comfortableInstallments(cappedComfortable)
                .itemPrice(price)
                .userBudget(budget)
                .build();
    }

    private static int roundedCount(BigDecimal price, BigDecimal payment) {
        BigDecimal count = price.divide(payment, MoneyUtils.MATH).setScale(0, RoundingMode.HALF_UP);
        return count.min(MAX_COUNT).intValue();
    }
}
