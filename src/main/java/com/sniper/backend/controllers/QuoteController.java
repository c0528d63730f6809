package com.sniper.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sniper.backend.dto.ApiResponse;
import com.sniper.backend.services.finance.FinanceEngine;
import com.sniper.backend.services.quotes.CurrencyQuote;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/quotes")
@RequiredArgsConstructor
@Slf4j
public class QuoteController {

    private final FinanceEngine financeEngine;

    @GetMapping("/usd-brl")
    public ResponseEntity<ApiResponse<CurrencyQuote>> usdBrl() {
        CurrencyQuote quote = financeEngine.currentQuote();
        log.info("[Quotes] rate={}, source={}, fallback={}", quote.rate(), quote.source(), quote.fallback());
        return ResponseEntity.ok(ApiResponse.success(quote, "Cotação: " + quote.formatted()));
    }
}
