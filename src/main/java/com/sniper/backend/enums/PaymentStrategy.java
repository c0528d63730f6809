package com.sniper.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentStrategy {
    CASH("cash", "À vista"),
    INSTALLMENT("installment", "Parcelado sem juros"),
    INSTALLMENT_CAUTION("installment_caution", "Parcelado com cautela"),
    NOT_RECOMMENDED("not_recommended", "Não recomendado");

    private final String code;
    private final String displayName;

    PaymentStrategy(String code, String displayName) {
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
