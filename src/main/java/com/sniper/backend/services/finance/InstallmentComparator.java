package com.sniper.backend.services.finance;

import java.math.BigDecimal;

import org.springframework.stereotype.Service;

import com.sniper.backend.config.FinanceEngineProperties;
import com.sniper.backend.enums.Currency;
import com.sniper.backend.enums.PaymentRecommendation;
import com.sniper.backend.services.finance.model.InstallmentComparison;
import com.sniper.backend.services.finance.rules.DecisionRule;
import com.sniper.backend.services.finance.rules.DecisionTable;

/**
 * À vista x parcelado considerando o valor do dinheiro no tempo.
 *
 * O fluxo de parcelas é trazido a valor presente pela inflação mensal equivalente
 * à anual configurada: {@code (1 + anual)^(1/12) - 1}.
 */
@Service
public class InstallmentComparator {

    private static final BigDecimal ELEVEN = BigDecimal.valueOf(11);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal ROOT_TOLERANCE = new BigDecimal("1E-32");
    private static final int ROOT_MAX_ITERATIONS = 50;

    private final FinanceEngineProperties properties;
    private final BigDecimal monthlyInflationRate;
    private final DecisionTable<PaymentContext, PaymentVerdict> decisions;

    public InstallmentComparator(FinanceEngineProperties properties) {
        this.properties = properties;
        this.monthlyInflationRate = monthlyRate(properties.annualInflationRate());
        this.decisions = DecisionTable.of("payment",
                DecisionRule.when("cash-discount",
                        ctx -> ctx.cashDiscountPct().compareTo(properties.cashDiscountThresholdPct()) >= 0,
                        ctx -> new PaymentVerdict(PaymentRecommendation.CASH,
                                "Pague à vista. Desconto de " + MoneyUtils.formatPercent(ctx.cashDiscountPct())
                                        + " supera ganho com inflação.",
                                ctx.cashDiscount())),
                DecisionRule.when("inflation-benefit",
                        ctx -> ctx.interestFree()
                                && ctx.netBenefit().compareTo(properties.installmentNetBenefitThreshold()) > 0,
                        ctx -> new PaymentVerdict(PaymentRecommendation.INSTALLMENT,
                                "Parcele sem juros. A inflação trabalha a seu favor, economia real de "
                                        + MoneyUtils.formatBrl(ctx.netBenefit()) + ".",
                                ctx.netBenefit())),
                DecisionRule.when("avoid-interest",
                        ctx -> !ctx.interestFree(),
                        ctx -> new PaymentVerdict(PaymentRecommendation.CASH,
                                "Pague à vista para evitar juros. Economia de "
                                        + MoneyUtils.formatBrl(ctx.cashDiscount()) + ".",
                                ctx.cashDiscount())),
                DecisionRule.otherwise("neutral",
                        ctx -> new PaymentVerdict(PaymentRecommendation.NEUTRAL,
                                "Diferença mínima. Escolha conforme seu fluxo de caixa.",
                                BigDecimal.ZERO)));
    }

    public InstallmentComparison compare(BigDecimal cashPrice, BigDecimal installmentPrice, Integer installments, boolean interestFree) {
        BigDecimal cash = FinanceValidation.requireNonNegative(cashPrice, "Preço à vista");
        BigDecimal total = FinanceValidation.requireNonNegative(installmentPrice, "Preço parcelado");
        int count = FinanceValidation.requireInstallmentCount(installments);

        BigDecimal cashDiscount = total.subtract(cash);
        BigDecimal cashDiscountPct = MoneyUtils.percentageOf(cashDiscount, total, BigDecimal.ZERO);
        BigDecimal monthly = total.divide(BigDecimal.valueOf(count), MoneyUtils.MATH);

        BigDecimal presentValue = presentValue(monthly, count);
        BigDecimal inflationSavings = total.subtract(presentValue);
        BigDecimal netBenefit = inflationSavings.subtract(cashDiscount);

        PaymentVerdict verdict = decisions.evaluate(
                new PaymentContext(cashDiscount, cashDiscountPct, netBenefit, interestFree));

        return InstallmentComparison.builder()
                .cashPrice(cash)
                .installmentPrice(total)
                .numInstallments(count)
                .monthlyInstallment(MoneyUtils.money(monthly))
                .cashDiscount(MoneyUtils.money(cashDiscount))
                .cashDiscountPercentage(MoneyUtils.percent(cashDiscountPct))
                .presentValueInstallments(MoneyUtils.money(presentValue))
                .inflationSavings(MoneyUtils.money(inflationSavings))
                .netBenefitInstallment(MoneyUtils.money(netBenefit))
                .interestFree(interestFree)
                .recommendation(verdict.recommendation())
                .recommendationText(verdict.text())
                .financialBenefit(MoneyUtils.money(verdict.benefit()))
                .annualInflationRate(properties.annualInflationRate().multiply(MoneyUtils.ONE_HUNDRED).stripTrailingZeros())
                .currency(Currency.BRL)
                .build();
    }

    /**
     * Soma de parcela / (1 + i)^m para m = 1..n, pela forma fechada
     * {@code parcela * (1 - (1 + i)^-n) / i}. Com i = 0 é parcela * n.
     */
    BigDecimal presentValue(BigDecimal monthlyInstallment, int count) {
        if (monthlyInflationRate.signum() == 0) {
            return monthlyInstallment.multiply(BigDecimal.valueOf(count), MoneyUtils.MATH);
        }
        BigDecimal growth = BigDecimal.ONE.add(monthlyInflationRate).pow(count, MoneyUtils.MATH);
        BigDecimal discounted = BigDecimal.ONE.subtract(BigDecimal.ONE.divide(growth, MoneyUtils.MATH));
        return monthlyInstallment.multiply(discounted, MoneyUtils.MATH)
                .divide(monthlyInflationRate, MoneyUtils.MATH);
    }

    BigDecimal monthlyInflationRate() {
        return monthlyInflationRate;
    }

    /** {@code (1 + anual)^(1/12) - 1} em DECIMAL128. */
    static BigDecimal monthlyRate(BigDecimal annualRate) {
        BigDecimal growth = BigDecimal.ONE.add(annualRate);
        if (growth.signum() <= 0) {
            throw new IllegalArgumentException("Inflação anual deve ser maior que -100%: " + annualRate);
        }
        return twelfthRoot(growth).subtract(BigDecimal.ONE, MoneyUtils.MATH);
    }

    // Newton para x^12 = valor, partindo da raiz em double.
    private static BigDecimal twelfthRoot(BigDecimal value) {
        BigDecimal root = BigDecimal.valueOf(Math.pow(value.doubleValue(), 1.0 / 12));
        for (int i = 0; i < ROOT_MAX_ITERATIONS; i++) {
            BigDecimal next = root.multiply(ELEVEN)
                    .add(value.divide(root.pow(11, MoneyUtils.MATH), MoneyUtils.MATH))
                    .divide(TWELVE, MoneyUtils.MATH);
            if (next.subtract(root).abs().compareTo(ROOT_TOLERANCE) <= 0) {
                return next;
            }
            root = next;
        }
        return root;
    }

    private record PaymentContext(
            BigDecimal cashDiscount,
            BigDecimal cashDiscountPct,
            BigDecimal netBenefit,
            boolean interestFree
    ) {
    }

    private record PaymentVerdict(
            PaymentRecommendation recommendation,
            String text,
            BigDecimal benefit
    ) {
    }
}
