package com.sniper.backend.services.finance;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Service;

import com.sniper.backend.config.FinanceEngineProperties;
import com.sniper.backend.enums.Currency;
import com.sniper.backend.enums.PaymentStrategy;
import com.sniper.backend.enums.RiskLevel;
import com.sniper.backend.services.finance.model.Offer;
import com.sniper.backend.services.finance.model.RankingResult;
import com.sniper.backend.services.finance.model.Recommendation;
import com.sniper.backend.services.finance.model.ScoredOffer;
import com.sniper.backend.services.finance.rules.DecisionRule;
import com.sniper.backend.services.finance.rules.DecisionTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Smart Choice: pontua as ofertas de várias lojas, ordena por score (estável, sem chave
 * secundária) e gera a recomendação a partir da melhor.
 */
@Service
@Slf4j
public class SmartChoiceEngine {

    private final OfferScorer offerScorer;
    private final FinanceEngineProperties properties;
    private final DecisionTable<OfferEvaluation, Recommendation> recommendations;

    public SmartChoiceEngine(OfferScorer offerScorer, FinanceEngineProperties properties) {
        this.offerScorer = offerScorer;
        this.properties = properties;
        this.recommendations = DecisionTable.of("smart-choice",
                DecisionRule.when("cash-with-discount",
                        e -> e.canAffordCash() && offerScorer.hasCashDiscount(e),
                        e -> recommend(e, PaymentStrategy.CASH, "Pague à Vista!",
                                String.format("Recomendado: %s à vista por %s. Economia de %s (%s de desconto).",
                                        e.offer().store(),
                                        MoneyUtils.formatBrl(e.offer().cashPrice()),
                                        MoneyUtils.formatBrl(e.cashDiscount()),
                                        MoneyUtils.formatPercent(e.cashDiscountPct())),
                                RiskLevel.LOW)),
                DecisionRule.when("interest-free",
                        e -> e.canAffordInstallment() && e.interestFree(),
                        e -> recommend(e, PaymentStrategy.INSTALLMENT, "Parcele sem Juros",
                                String.format("Recomendado: %s em %dx de %s sem juros. Cabe no seu bolso!",
                                        e.offer().store(),
                                        e.installmentCount(),
                                        MoneyUtils.formatBrl(e.monthlyInstallment())),
                                riskForCommitment(e.commitmentPct()))),
                DecisionRule.when("cash",
                        OfferEvaluation::canAffordCash,
                        e -> recommend(e, PaymentStrategy.CASH, "Compra à Vista",
                                String.format("Você pode comprar na %s à vista por %s. Sem comprometer seu fluxo mensal.",
                                        e.offer().store(),
                                        MoneyUtils.formatBrl(e.offer().cashPrice())),
                                RiskLevel.LOW)),
                DecisionRule.when("installment-caution",
                        OfferEvaluation::canAffordInstallment,
                        e -> recommend(e, PaymentStrategy.INSTALLMENT_CAUTION, "Parcelamento com Cautela",
                                String.format("%s oferece %dx de %s, mas isso compromete %s do seu fluxo. Avalie com cuidado.",
                                        e.offer().store(),
                                        e.installmentCount(),
                                        MoneyUtils.formatBrl(e.monthlyInstallment()),
                                        MoneyUtils.formatWholePercent(e.commitmentPct())),
                                RiskLevel.HIGH)),
                DecisionRule.otherwise("not-recommended",
                        e -> recommend(e, PaymentStrategy.NOT_RECOMMENDED, "Fora do Orçamento",
                                "Este produto está acima do seu orçamento atual. "
                                        + "Considere economizar ou buscar alternativas mais baratas.",
                                RiskLevel.CRITICAL)));
    }

    public RankingResult rank(BigDecimal availableCash, BigDecimal monthlyCapacity, List<Offer> offers) {
        BigDecimal cash = MoneyUtils.nz(availableCash);
        BigDecimal capacity = MoneyUtils.nz(monthlyCapacity);

        if (offers == null || offers.isEmpty()) {
            log.debug("[SmartChoice] no offers");
            return RankingResult.noOffers(cash, capacity);
        }

        List<Ranked> ranked = new ArrayList<>(offers.size());
        for (Offer offer : offers) {
            OfferEvaluation evaluation = offerScorer.evaluate(offer, cash, capacity);
            ranked.add(new Ranked(evaluation, toScoredOffer(evaluation, offerScorer.score(evaluation))));
        }
        // List.sort is a stable merge sort: equal scores keep input order
        ranked.sort(Comparator.comparing((Ranked r) -> r.scored().score()).reversed());

        Ranked best = ranked.get(0);
        Recommendation recommendation = recommendations.evaluate(best.evaluation());

        return new RankingResult(
                best.scored(),
                ranked.stream().map(Ranked::scored).toList(),
                recommendation,
                cash,
                capacity,
                null,
                Currency.BRL);
    }

    RiskLevel riskForCommitment(BigDecimal commitmentPct) {
        if (commitmentPct.compareTo(properties.safeCommitmentPct()) <= 0) {
            return RiskLevel.LOW;
        }
        if (commitmentPct.compareTo(properties.maxCommitmentPct()) <= 0) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.HIGH;
    }

    private static Recommendation recommend(OfferEvaluation e, PaymentStrategy strategy, String title, String message, RiskLevel risk) {
        return new Recommendation(strategy, title, message, risk, e.offer().store());
    }

    private static ScoredOffer toScoredOffer(OfferEvaluation e, BigDecimal score) {
        Offer offer = e.offer();
        return ScoredOffer.builder()
                .store(offer.store())
                .cashPrice(offer.cashPrice())
                .installmentPrice(offer.installmentPrice())
                .installmentCount(offer.installmentCount())
                .monthlyInstallment(MoneyUtils.money(e.monthlyInstallment()))
                .interestFree(offer.interestFree())
                .canAffordCash(e.canAffordCash())
                .canAffordInstallment(e.canAffordInstallment())
                .cashDiscount(MoneyUtils.money(e.cashDiscount()))
                .cashDiscountPct(MoneyUtils.percent(e.cashDiscountPct()))
                .commitmentPct(MoneyUtils.percent(e.commitmentPct()))
                .score(score)
                .url(offer.url())
                .currency(Currency.BRL)
                .build();
    }

    private record Ranked(OfferEvaluation evaluation, ScoredOffer scored) {
    }
}
