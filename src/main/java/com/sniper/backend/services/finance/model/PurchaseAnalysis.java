package com.sniper.backend.services.finance.model;

public record PurchaseAnalysis(
        CapacitySnapshot userCapacity,
        RankingResult ranking
) {
}
