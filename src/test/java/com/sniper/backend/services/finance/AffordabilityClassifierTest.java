package com.sniper.backend.services.finance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.sniper.backend.config.FinanceEngineProperties;
import com.sniper.backend.enums.AffordabilityStrategy;
import com.sniper.backend.enums.RiskLevel;
import com.sniper.backend.exceptions.BadRequestException;
import com.sniper.backend.services.finance.model.AffordabilityResult;
import com.sniper.backend.services.finance.model.FinancialProfile;

class AffordabilityClassifierTest {

    private final AffordabilityClassifier classifier = new AffordabilityClassifier(FinanceEngineProperties.defaults());

    @Test
    void classify_zeroIncome_isNotAffordableWithSentinels() {
        FinancialProfile profile = FinancialProfile.of(BigDecimal.ZERO, BigDecimal.ZERO);

        AffordabilityResult result = classify(profile, "1000", "1000", 10);

        assertEquals(AffordabilityStrategy.NOT_AFFORDABLE, result.recommendation());
        assertEquals(RiskLevel.CRITICAL, result.riskLevel());
        assertEquals(999, result.monthsToSaveCash());
        assertEquals(new BigDecimal("999.0"), result.newCommitmentPct());
        assertEquals(new BigDecimal("999.0"), result.installmentAsIncomePct());
        assertFalse(result.canAffordCash());
        assertFalse(result.canAffordInstallment());
        assertEquals("Fora do orçamento atual", result.strategy());
    }

    @Test
    void classify_cashFitsWithDiscount_isCashImmediate() {
        AffordabilityResult result = classify(profile("10000", "3000", "0"), "900", "1000", 10);

        assertEquals(AffordabilityStrategy.CASH_IMMEDIATE, result.recommendation());
        assertEquals(RiskLevel.LOW, result.riskLevel());
        assertEquals("À vista imediato", result.strategy());
        assertEquals("Você tem fluxo de caixa e o desconto de 10,0% vale a pena. Economia de R$ 100,00.", result.reason());
    }

    @Test
    void classify_lowCommitment_isInstallmentSafe() {
        AffordabilityResult result = classify(profile("5000", "2000", "0"), "5000", "5000", 10);

        assertEquals(AffordabilityStrategy.INSTALLMENT_SAFE, result.recommendation());
        assertEquals(RiskLevel.LOW, result.riskLevel());
        assertEquals(new BigDecimal("20.0"), result.newCommitmentPct());
        assertEquals("Parcelado em 10x", result.strategy());
        assertEquals("Parcela de R$ 500,00 compromete apenas 10,0% da sua renda. Seguro.", result.reason());
    }

    @Test
    void classify_commitmentUpToFifty_isInstallmentModerate() {
        AffordabilityResult result = classify(profile("5000", "2000", "500"), "5000", "5000", 10);

        assertEquals(AffordabilityStrategy.INSTALLMENT_MODERATE, result.recommendation());
        assertEquals(RiskLevel.MEDIUM, result.riskLevel());
        assertEquals("Parcelado em 10x (atenção)", result.strategy());
        assertTrue(result.reason().contains("40,0%"));
    }

    @Test
    void classify_commitmentAboveFifty_isInstallmentRisky() {
        AffordabilityResult result = classify(profile("5000", "2000", "1000"), "5000", "5000", 10);

        assertEquals(AffordabilityStrategy.INSTALLMENT_RISKY, result.recommendation());
        assertEquals(RiskLevel.HIGH, result.riskLevel());
        assertEquals("Parcelado em 10x (arriscado)", result.strategy());
        assertEquals("A parcela cabe, mas comprometeria 60,0% do seu fluxo livre. Alto risco financeiro.", result.reason());
    }

    @Test
    void classify_reachableBySaving_isSaveFirst() {
        AffordabilityResult result = classify(profile("5000", "2000", "2000"), "2000", "2400", 2);

        assertEquals(AffordabilityStrategy.SAVE_FIRST, result.recommendation());
        assertEquals(RiskLevel.LOW, result.riskLevel());
        assertEquals(4, result.monthsToSaveCash());
        assertEquals("Economizar por 4 meses", result.strategy());
        assertEquals("Não cabe agora, mas economizando R$ 500,00/mês você compra à vista em 4 meses.", result.reason());
    }

    @Test
    void classify_monthsToSave_roundsUp() {
        AffordabilityResult result = classify(profile("5000", "2000", "2000"), "2100", "2400", 2);

        assertEquals(5, result.monthsToSaveCash());
        assertEquals(AffordabilityStrategy.SAVE_FIRST, result.recommendation());
    }

    @Test
    void classify_tooExpensive_isNotAffordable() {
        AffordabilityResult result = classify(profile("5000", "2000", "2000"), "10000", "10000", 2);

        assertEquals(20, result.monthsToSaveCash());
        assertEquals(AffordabilityStrategy.NOT_AFFORDABLE, result.recommendation());
        assertEquals(RiskLevel.CRITICAL, result.riskLevel());
    }

    @Test
    void classify_reportsDiscountAndIncomeShare() {
        AffordabilityResult result = classify(profile("5000", "2000", "0"), "4500", "5000", 10);

        assertEquals(new BigDecimal("500.00"), result.cashDiscount());
        assertEquals(new BigDecimal("10.0"), result.cashDiscountPct());
        assertEquals(new BigDecimal("10.0"), result.installmentAsIncomePct());
        assertEquals(new BigDecimal("500.00"), result.monthlyInstallment());
    }

    @Test
    void classify_negativePrice_throwsBadRequest() {
        assertThrows(BadRequestException.class,
                () -> classify(profile("5000", "2000", "0"), "-1", "100", 1));
    }

    @Test
    void monthsToSave_nonPositiveBudget_returnsSentinel() {
        assertEquals(999, AffordabilityClassifier.monthsToSave(new BigDecimal("100"), BigDecimal.ZERO));
        assertEquals(999, AffordabilityClassifier.monthsToSave(new BigDecimal("100"), new BigDecimal("-5")));
        assertEquals(0, AffordabilityClassifier.monthsToSave(BigDecimal.ZERO, new BigDecimal("5")));
    }

    private AffordabilityResult classify(FinancialProfile profile, String cash, String installment, int count) {
        return classifier.classify(profile, new BigDecimal(cash), new BigDecimal(installment), count);
    }

    private static FinancialProfile profile(String income, String expenses, String commitments) {
        return new FinancialProfile(new BigDecimal(income), new BigDecimal(expenses), null, new BigDecimal(commitments));
    }
}
