package com.sniper.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AffordabilityStrategy {
    CASH_IMMEDIATE("cash_immediate", "À vista imediato"),
    INSTALLMENT_SAFE("installment_safe", "Parcelamento seguro"),
    INSTALLMENT_MODERATE("installment_moderate", "Parcelamento moderado"),
    INSTALLMENT_RISKY("installment_risky", "Parcelamento arriscado"),
    SAVE_FIRST("save_first", "Economizar antes"),
    NOT_AFFORDABLE("not_affordable", "Fora do orçamento");

    private final String code;
    private final String displayName;

    AffordabilityStrategy(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }
}
