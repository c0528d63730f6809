package com.sniper.backend.controllers;

import java.math.BigDecimal;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.sniper.backend.dto.ApiResponse;
import com.sniper.backend.services.finance.MoneyUtils;

import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/prices")
@Slf4j
public class PriceController {

    @GetMapping("/parse")
    public ResponseEntity<ApiResponse<BigDecimal>> parse(@RequestParam("value") String value) {
        log.info("[Prices] parse value={}", value);
        BigDecimal price = MoneyUtils.parsePriceOrThrow(value);
        return ResponseEntity.ok(ApiResponse.success(price, MoneyUtils.formatBrl(price)));
    }
}
