package com.sniper.backend.controllers;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.sniper.backend.config.FinanceEngineProperties;
import com.sniper.backend.enums.Currency;
import com.sniper.backend.services.finance.CapacityCalculator;
import com.sniper.backend.services.finance.FinanceEngine;
import com.sniper.backend.services.finance.model.CapacitySnapshot;
import com.sniper.backend.services.finance.model.FinancialProfile;

@WebMvcTest(CapacityController.class)
class CapacityControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    FinanceEngine financeEngine;

    @Test
    void compute_validProfile_returnsSnapshot() throws Exception {
        CapacitySnapshot snapshot = new CapacityCalculator(FinanceEngineProperties.defaults())
                .calculate(FinancialProfile.of(new BigDecimal("5000"), new BigDecimal("2000")));
        when(financeEngine.computeCapacity(any(FinancialProfile.class))).thenReturn(snapshot);

        mockMvc.perform(post("/api/capacity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"monthlyIncome\": 5000, \"fixedExpenses\": 2000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.freeCashFlow").value(2500.0))
                .andExpect(jsonPath("$.data.currency").value(Currency.BRL.name()));
    }

    @Test
    void compute_negativeIncome_returnsValidationError() throws Exception {
        mockMvc.perform(post("/api/capacity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"monthlyIncome\": -1, \"fixedExpenses\": 2000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Erro de validação"))
                .andExpect(jsonPath("$.errors", hasItem(startsWith("monthlyIncome"))));

        verify(financeEngine, never()).computeCapacity(any());
    }

    @Test
    void compute_marginAboveHundred_returnsValidationError() throws Exception {
        mockMvc.perform(post("/api/capacity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"monthlyIncome\": 5000, \"fixedExpenses\": 2000, \"safetyMarginPct\": 150}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors", hasItem("safetyMarginPct: Margem de segurança deve estar entre 0 e 100")));
    }

    @Test
    void compute_malformedBody_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/capacity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"monthlyIncome\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Corpo da requisição inválido"));
    }
}
