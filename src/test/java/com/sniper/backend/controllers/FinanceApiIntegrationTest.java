package com.sniper.backend.controllers;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.sniper.backend.services.quotes.CurrencyQuote;
import com.sniper.backend.services.quotes.CurrencyRateProvider;

@SpringBootTest
@AutoConfigureMockMvc
class FinanceApiIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    CurrencyRateProvider currencyRateProvider;

    @BeforeEach
    void setUp() {
        when(currencyRateProvider.getCurrentRate()).thenReturn(
                CurrencyQuote.usdBrl(new BigDecimal("5.00"), LocalDateTime.of(2024, 5, 10, 14, 59, 58), "test"));
    }

    @Test
    void importAnalysis_reducedTier_matchesExpectedBreakdown() throws Exception {
        mockMvc.perform(post("/api/imports/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"priceUsd\": 40, \"shippingUsd\": 0, \"nationalPriceBrl\": 400}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.breakdown.importTaxRate").value(0.20))
                .andExpect(jsonPath("$.data.breakdown.totalBrl").value(280.80))
                .andExpect(jsonPath("$.data.breakdown.sourceCurrency").value("USD"))
                .andExpect(jsonPath("$.data.comparison.recommendation").value("import"))
                .andExpect(jsonPath("$.data.comparison.savings").value(119.20));
    }

    @Test
    void paymentAnalysis_tenPercentDiscount_recommendsCash() throws Exception {
        mockMvc.perform(post("/api/payments/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cashPrice\": 900, \"installmentPrice\": 1000, \"installmentCount\": 10, \"interestFree\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.recommendation").value("cash"))
                .andExpect(jsonPath("$.data.financialBenefit").value(100.00));
    }

    @Test
    void smartChoice_rank_picksDiscountedStore() throws Exception {
        mockMvc.perform(post("/api/smart-choice/rank")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"availableCash": 1000, "monthlyCapacity": 200, "offers": [
                                  {"store": "Kabum", "cashPrice": 1000, "installmentPrice": 1000, "installmentCount": 10},
                                  {"store": "Amazon", "cashPrice": 900, "installmentPrice": 1000, "installmentCount": 10}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.bestOption.store").value("Amazon"))
                .andExpect(jsonPath("$.data.bestOption.score").value(96.0))
                .andExpect(jsonPath("$.data.recommendation.strategy").value("cash"))
                .andExpect(jsonPath("$.data.recommendation.riskLevel").value("low"))
                .andExpect(jsonPath("$.data.allOptions.length()").value(2));
    }

    @Test
    void smartChoice_purchase_withEmptyOffers_isUnprocessable() throws Exception {
        mockMvc.perform(post("/api/smart-choice/purchase")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"profile\": {\"monthlyIncome\": 5000, \"fixedExpenses\": 2000}, \"offers\": []}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("Nenhuma opção de loja fornecida"));
    }

    @Test
    void affordability_zeroIncome_isNotAffordable() throws Exception {
        mockMvc.perform(post("/api/affordability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"profile": {"monthlyIncome": 0, "fixedExpenses": 0},
                                 "itemCashPrice": 1000, "itemInstallmentPrice": 1000, "installmentCount": 10}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.recommendation").value("not_affordable"))
                .andExpect(jsonPath("$.data.riskLevel").value("critical"))
                .andExpect(jsonPath("$.data.monthsToSaveCash").value(999));
    }

    @Test
    void affordability_nestedProfileValidation_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/affordability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"profile": {"monthlyIncome": 5000, "fixedExpenses": -10},
                                 "itemCashPrice": 1000, "installmentCount": 10}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("profile.fixedExpenses: Gastos fixos não podem ser negativos"));
    }

    @Test
    void paymentPlanAndSuggestion_areServed() throws Exception {
        mockMvc.perform(post("/api/payments/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalPrice\": 1000, \"installmentCount\": 12, \"monthlyInterestRate\": 0.0199}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.installmentValue").value(94.50))
                .andExpect(jsonPath("$.data.interestFree").value(false));

        mockMvc.perform(post("/api/payments/suggest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemPrice\": 1200, \"monthlyBudget\": 500}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.suggestion").value("Ideal: 8x (parcela confortável de R$ 150,00)"));
    }

    @Test
    void projectSummary_overBudget_returnsAlert() throws Exception {
        mockMvc.perform(post("/api/projects/summary")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Setup Gamer", "projectType": "pc", "monthlyBudget": 400, "items": [
                                  {"name": "Placa de Vídeo", "store": "Kabum", "cashPrice": 2000, "installmentPrice": 2200, "installmentCount": 10},
                                  {"name": "Memória RAM", "cashPrice": 300, "installmentPrice": 300, "installmentCount": 3, "quantity": 2}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalMonthlyInstallment").value(420.00))
                .andExpect(jsonPath("$.data.overBudget").value(true))
                .andExpect(jsonPath("$.data.budgetAlert.alert").value(true))
                .andExpect(jsonPath("$.data.projectType").value("pc"))
                .andExpect(jsonPath("$.data.suggestions.missingItems.length()").value(10))
                .andExpect(jsonPath("$.data.suggestions.priorityOrder[0]").value("Processador (CPU)"));
    }

    @Test
    void projectSuggestions_listsMissingCatalogItems() throws Exception {
        mockMvc.perform(post("/api/projects/suggestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Apartamento\", \"projectType\": \"moveis\", \"existingItems\": [\"Sofá retrátil\", \"Cama box\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.projectType").value("moveis"))
                .andExpect(jsonPath("$.data.missingItems.length()").value(5))
                .andExpect(jsonPath("$.data.suggestions[0]").value("Mesa"))
                .andExpect(jsonPath("$.data.reasoning").value("Baseado no tipo de projeto selecionado."));
    }

    @Test
    void projectSuggestions_unknownType_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/projects/suggestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Garagem\", \"projectType\": \"carro\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Tipo de projeto inválido: carro"));
    }

    @Test
    void paymentAnalysis_installmentCountAboveLimit_returnsValidationError() throws Exception {
        mockMvc.perform(post("/api/payments/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cashPrice\": 1000, \"installmentPrice\": 1000, \"installmentCount\": 2000000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Erro de validação"))
                .andExpect(jsonPath("$.errors[0]").value("installmentCount: Número de parcelas deve ser no máximo 360"));
    }
}
