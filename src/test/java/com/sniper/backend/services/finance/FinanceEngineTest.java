package com.sniper.backend.services.finance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sniper.backend.config.FinanceEngineProperties;
import com.sniper.backend.config.ImportTaxProperties;
import com.sniper.backend.enums.ImportRecommendation;
import com.sniper.backend.enums.ProjectType;
import com.sniper.backend.services.finance.model.AffordabilityResult;
import com.sniper.backend.services.finance.model.FinancialProfile;
import com.sniper.backend.services.finance.model.ImportAnalysis;
import com.sniper.backend.services.finance.model.InstallmentComparison;
import com.sniper.backend.services.finance.model.Offer;
import com.sniper.backend.services.finance.model.ProjectItem;
import com.sniper.backend.services.finance.model.ProjectSummary;
import com.sniper.backend.services.finance.model.PurchaseAnalysis;
import com.sniper.backend.services.finance.model.RankingResult;
import com.sniper.backend.services.quotes.CurrencyQuote;
import com.sniper.backend.services.quotes.CurrencyRateProvider;

@ExtendWith(MockitoExtension.class)
class FinanceEngineTest {

    @Mock
    private CurrencyRateProvider currencyRateProvider;

    private FinanceEngine engine;

    @BeforeEach
    void setUp() {
        FinanceEngineProperties properties = FinanceEngineProperties.defaults();
        OfferScorer scorer = new OfferScorer(properties);
        engine = new FinanceEngine(
                new CapacityCalculator(properties),
                new ImportCostCalculator(ImportTaxProperties.defaults(), currencyRateProvider),
                new InstallmentComparator(properties),
                new InstallmentPlanner(properties),
                new SmartChoiceEngine(scorer, properties),
                new AffordabilityClassifier(properties),
                new ProjectBudgetCalculator(),
                new ProjectSuggestionEngine(),
                currencyRateProvider);
    }

    @Test
    void analyzePurchase_usesAvailableCashAndSafeCapacity() {
        FinancialProfile profile = new FinancialProfile(
                new BigDecimal("5000"), new BigDecimal("2000"), null, new BigDecimal("300"));

        PurchaseAnalysis analysis = engine.analyzePurchase(profile, offers());

        assertEquals(0, new BigDecimal("2200").compareTo(analysis.ranking().userAvailableCash()));
        assertEquals(0, new BigDecimal("750").compareTo(analysis.ranking().userMonthlyCapacity()));
        assertEquals(analysis.userCapacity().availableForNew(), analysis.ranking().userAvailableCash());
        assertEquals("Amazon", analysis.ranking().bestOption().store());
    }

    @Test
    void analyzeImport_withDomesticPrice_comparesWithProviderQuote() {
        when(currencyRateProvider.getCurrentRate()).thenReturn(
                CurrencyQuote.usdBrl(new BigDecimal("5.00"), LocalDateTime.of(2024, 5, 10, 12, 0), "test"));

        ImportAnalysis analysis = engine.analyzeImport(new BigDecimal("100"), BigDecimal.ZERO, new BigDecimal("1200"), true);

        assertTrue(analysis.hasComparison());
        assertEquals(new BigDecimal("936.00"), analysis.breakdown().totalBrl());
        assertEquals(ImportRecommendation.IMPORT, analysis.comparison().recommendation());
        assertEquals(new BigDecimal("264.00"), analysis.comparison().savings());
    }

    @Test
    void currentQuote_delegatesToProvider() {
        CurrencyQuote quote = CurrencyQuote.fallback(new BigDecimal("5.50"), LocalDateTime.of(2024, 1, 1, 0, 0));
        when(currencyRateProvider.getCurrentRate()).thenReturn(quote);

        assertEquals(quote, engine.currentQuote());
        verify(currencyRateProvider).getCurrentRate();
    }

    @Test
    void repeatedCalls_withSameInputs_returnEqualResults() {
        FinancialProfile profile = new FinancialProfile(
                new BigDecimal("7300.45"), new BigDecimal("2100.10"), new BigDecimal("12.5"), new BigDecimal("410"));

        RankingResult firstRanking = engine.rankOffers(new BigDecimal("3000"), new BigDecimal("900"), offers());
        RankingResult secondRanking = engine.rankOffers(new BigDecimal("3000"), new BigDecimal("900"), offers());
        assertEquals(firstRanking, secondRanking);

        AffordabilityResult firstAffordability = engine.classifyAffordability(profile, new BigDecimal("4599.90"), new BigDecimal("4999.90"), 10);
        AffordabilityResult secondAffordability = engine.classifyAffordability(profile, new BigDecimal("4599.90"), new BigDecimal("4999.90"), 10);
        assertEquals(firstAffordability, secondAffordability);

        InstallmentComparison firstPayment = engine.analyzePayment(new BigDecimal("1899"), new BigDecimal("2099"), 12, true);
        InstallmentComparison secondPayment = engine.analyzePayment(new BigDecimal("1899"), new BigDecimal("2099"), 12, true);
        assertEquals(firstPayment, secondPayment);

        assertEquals(engine.computeCapacity(profile), engine.computeCapacity(profile));
    }

    private static List<Offer> offers() {
        return List.of(
                Offer.of("Kabum", new BigDecimal("2000"), new BigDecimal("2000"), 10, true),
                Offer.of("Amazon", new BigDecimal("1800"), new BigDecimal("2000"), 10, true),
                Offer.of("Pichau", new BigDecimal("2100"), new BigDecimal("2300"), 12, false));
    }

    @Test
    void summarizeProject_attachesMissingCatalogItems() {
        ProjectItem gpu = ProjectItem.builder()
                .name("Placa de Video")
                .store("Kabum")
                .cashPrice(new BigDecimal("2000"))
                .installmentPrice(new BigDecimal("2200"))
                .installmentCount(10)
                .quantity(1)
                .interestFree(true)
                .build();

        ProjectSummary summary = engine.summarizeProject("Setup Gamer", ProjectType.PC, List.of(gpu), new BigDecimal("500"));

        assertEquals(ProjectType.PC, summary.projectType());
        assertEquals(new BigDecimal("220.00"), summary.totalMonthlyInstallment());
        assertEquals(List.of("Placa de Video"), summary.suggestions().existingItems());
        assertEquals(11, summary.suggestions().missingItems().size());
        assertEquals("Processador (CPU)", summary.suggestions().missingItems().get(0));
    }
}
