package com.sniper.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW("low", "Baixo"),
    MEDIUM("medium", "Médio"),
    HIGH("high", "Alto"),
    CRITICAL("critical", "Crítico");

    private final String code;
    private final String displayName;

    RiskLevel(String code, String displayName) {
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
