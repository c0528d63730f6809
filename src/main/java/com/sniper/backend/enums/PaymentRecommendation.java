package com.sniper.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentRecommendation {
    CASH("cash", "Pagar à vista"),
    INSTALLMENT("installment", "Parcelar"),
    NEUTRAL("neutral", "Indiferente");

    private final String code;
    private final String displayName;

    PaymentRecommendation(String code, String displayName) {
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
