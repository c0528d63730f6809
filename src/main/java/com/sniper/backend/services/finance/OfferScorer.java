package com.sniper.backend.services.finance;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.springframework.stereotype.Component;

import com.sniper.backend.config.FinanceEngineProperties;
import com.sniper.backend.services.finance.model.Offer;
import com.sniper.backend.services.finance.rules.DecisionRule;
import com.sniper.backend.services.finance.rules.DecisionTable;

/**
 * Score 0-100 de uma oferta. Primeira regra que casa:
 *
 * <pre>
 * a. à vista com desconto >= 10%          95 + desconto% * 0.1
 * b. parcela sem juros, 18x ou mais       90 - comprometimento% * 0.2
 * c. parcela sem juros, 12x ou mais       85 - comprometimento% * 0.2
 * d. parcela sem juros, menos de 12x      75 - comprometimento% * 0.3
 * e. à vista sem desconto relevante       70 + desconto% * 0.5
 * f. parcela com juros                    50 - comprometimento% * 0.3
 * g. nada cabe                            max(0, 20 - preço / 1000)
 * </pre>
 */
@Component
public class OfferScorer {

    private static final BigDecimal MIN_SCORE = BigDecimal.ZERO;
    private static final BigDecimal MAX_SCORE = new BigDecimal("100");
    private static final BigDecimal THOUSAND = new BigDecimal("1000");

    private final FinanceEngineProperties properties;
    private final DecisionTable<OfferEvaluation, BigDecimal> scoring;

    public OfferScorer(FinanceEngineProperties properties) {
        this.properties = properties;
        this.scoring = DecisionTable.of("offer-score",
                DecisionRule.when("cash-with-discount",
                        e -> e.canAffordCash() && hasCashDiscount(e),
                        e -> base("95").add(weighted(e.cashDiscountPct(), "0.1"))),
                DecisionRule.when("interest-free-long",
                        e -> interestFreeFits(e) && e.installmentCount() >= properties.longInstallmentCount(),
                        e -> base("90").subtract(weighted(e.commitmentPct(), "0.2"))),
                DecisionRule.when("interest-free-medium",
                        e -> interestFreeFits(e) && e.installmentCount() >= properties.mediumInstallmentCount(),
                        e -> base("85").subtract(weighted(e.commitmentPct(), "0.2"))),
                DecisionRule.when("interest-free-short",
                        this::interestFreeFits,
                        e -> base("75").subtract(weighted(e.commitmentPct(), "0.3"))),
                DecisionRule.when("cash",
                        OfferEvaluation::canAffordCash,
                        e -> base("70").add(weighted(e.cashDiscountPct(), "0.5"))),
                DecisionRule.when("installment-with-interest",
                        OfferEvaluation::canAffordInstallment,
                        e -> base("50").subtract(weighted(e.commitmentPct(), "0.3"))),
                DecisionRule.otherwise("unaffordable",
                        e -> base("20").subtract(e.offer().cashPrice().divide(THOUSAND, MoneyUtils.MATH)).max(BigDecimal.ZERO)));
    }

    /**
     * Cruza a oferta com o caixa disponível (à vista) e a capacidade mensal (parcela).
     * Capacidade zero ou negativa leva o comprometimento ao sentinela 999.
     */
    public OfferEvaluation evaluate(Offer offer, BigDecimal availableCash, BigDecimal monthlyCapacity) {
        BigDecimal monthly = offer.monthlyInstallment();
        BigDecimal cashDiscount = offer.installmentPrice().subtract(offer.cashPrice());

        return new OfferEvaluation(
                offer,
                monthly,
                availableCash.compareTo(offer.cashPrice()) >= 0,
                monthlyCapacity.compareTo(monthly) >= 0,
                cashDiscount,
                MoneyUtils.percentageOf(cashDiscount, offer.installmentPrice(), BigDecimal.ZERO),
                MoneyUtils.percentageOf(monthly, monthlyCapacity, MoneyUtils.PERCENT_SENTINEL));
    }

    /** Score limitado a [0, 100], uma casa decimal. */
    public BigDecimal score(OfferEvaluation evaluation) {
        BigDecimal raw = scoring.evaluate(evaluation);
        return raw.max(MIN_SCORE).min(MAX_SCORE).setScale(1, RoundingMode.HALF_UP);
    }

    public String matchedRule(OfferEvaluation evaluation) {
        return scoring.match(evaluation).name();
    }

    boolean hasCashDiscount(OfferEvaluation evaluation) {
        return evaluation.cashDiscountPct().compareTo(properties.cashDiscountThresholdPct()) >= 0;
    }

    private boolean interestFreeFits(OfferEvaluation evaluation) {
        return evaluation.canAffordInstallment() && evaluation.interestFree();
    }

    private static BigDecimal base(String value) {
        return new BigDecimal(value);
    }

    private static BigDecimal weighted(BigDecimal value, String weight) {
        return value.multiply(new BigDecimal(weight));
    }
}
