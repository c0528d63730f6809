package com.sniper.backend.services.finance;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Service;

import com.sniper.backend.enums.ProjectType;
import com.sniper.backend.services.finance.model.AffordabilityResult;
import com.sniper.backend.services.finance.model.CapacitySnapshot;
import com.sniper.backend.services.finance.model.FinancialProfile;
import com.sniper.backend.services.finance.model.ImportAnalysis;
import com.sniper.backend.services.finance.model.InstallmentComparison;
import com.sniper.backend.services.finance.model.InstallmentPlan;
import com.sniper.backend.services.finance.model.InstallmentSuggestion;
import com.sniper.backend.services.finance.model.Offer;
import com.sniper.backend.services.finance.model.ProjectItem;
import com.sniper.backend.services.finance.model.ProjectItemSummary;
import com.sniper.backend.services.finance.model.ProjectSuggestions;
import com.sniper.backend.services.finance.model.ProjectSummary;
import com.sniper.backend.services.finance.model.PurchaseAnalysis;
import com.sniper.backend.services.finance.model.RankingResult;
import com.sniper.backend.services.quotes.CurrencyQuote;
import com.sniper.backend.services.quotes.CurrencyRateProvider;

import lombok.RequiredArgsConstructor;

/**
 * Ponto de entrada do motor de decisão. Sem estado: cada chamada devolve objetos novos,
 * então pode ser usado de várias requisições ao mesmo tempo.
 */
@Service
@RequiredArgsConstructor
public class FinanceEngine {

    private final CapacityCalculator capacityCalculator;
    private final ImportCostCalculator importCostCalculator;
    private final InstallmentComparator installmentComparator;
    private final InstallmentPlanner installmentPlanner;
    private final SmartChoiceEngine smartChoiceEngine;
    private final AffordabilityClassifier affordabilityClassifier;
    private final ProjectBudgetCalculator projectBudgetCalculator;
    private final ProjectSuggestionEngine projectSuggestionEngine;
    private final CurrencyRateProvider currencyRateProvider;

    public CapacitySnapshot computeCapacity(FinancialProfile profile) {
        return capacityCalculator.calculate(profile);
    }

    public ImportAnalysis analyzeImport(BigDecimal priceUsd, BigDecimal shippingUsd, BigDecimal domesticPrice, boolean remessaConforme) {
        return importCostCalculator.analyze(priceUsd, shippingUsd, domesticPrice, remessaConforme);
    }

    public InstallmentComparison analyzePayment(BigDecimal cashPrice, BigDecimal installmentPrice, Integer installments, boolean interestFree) {
        return installmentComparator.compare(cashPrice, installmentPrice, installments, interestFree);
    }

    public RankingResult rankOffers(BigDecimal availableCash, BigDecimal monthlyCapacity, List<Offer> offers) {
        return smartChoiceEngine.rank(availableCash, monthlyCapacity, offers);
    }

    public AffordabilityResult classifyAffordability(FinancialProfile profile, BigDecimal itemCashPrice, BigDecimal itemInstallmentPrice, Integer installments) {
        return affordabilityClassifier.classify(profile, itemCashPrice, itemInstallmentPrice, installments);
    }

    /**
     * Smart Choice a partir do perfil: caixa = fluxo livre - compromissos,
     * capacidade mensal = capacidade segura.
     */
    public PurchaseAnalysis analyzePurchase(FinancialProfile profile, List<Offer> offers) {
        CapacitySnapshot capacity = capacityCalculator.calculate(profile);
        RankingResult ranking = smartChoiceEngine.rank(
                capacity.availableForNew(), capacity.safeInstallmentCapacity(), offers);
        return new PurchaseAnalysis(capacity, ranking);
    }

    public InstallmentPlan calculateInstallmentPlan(BigDecimal totalPrice, Integer installments, BigDecimal monthlyRate) {
        return installmentPlanner.plan(totalPrice, installments, monthlyRate);
    }

    public InstallmentSuggestion suggestInstallments(BigDecimal itemPrice, BigDecimal monthlyBudget, Integer maxInstallments) {
        return installmentPlanner.suggest(itemPrice, monthlyBudget, maxInstallments);
    }

    /** Totais do projeto e, com base nos nomes dos itens, o que ainda falta para o tipo do projeto. */
    public ProjectSummary summarizeProject(String name, ProjectType projectType, List<ProjectItem> items, BigDecimal monthlyBudget) {
        ProjectSummary summary = projectBudgetCalculator.summarize(name, projectType, items, monthlyBudget);
        List<String> itemNames = summary.items().stream().map(ProjectItemSummary::name).toList();
        return summary.toBuilder()
                .suggestions(projectSuggestionEngine.suggest(name, summary.projectType(), itemNames))
                .build();
    }

    public ProjectSuggestions suggestProjectItems(String projectName, ProjectType projectType, List<String> existingItems) {
        return projectSuggestionEngine.suggest(projectName, projectType, existingItems);
    }

    public CurrencyQuote currentQuote() {
        return currencyRateProvider.getCurrentRate();
    }
}
