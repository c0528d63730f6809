package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

public record BudgetAlert(
        boolean alert,
        String message,
        BigDecimal difference
) {
    public static BudgetAlert none() {
        return new BudgetAlert(false, null, BigDecimal.ZERO.setScale(2));
    }
}
