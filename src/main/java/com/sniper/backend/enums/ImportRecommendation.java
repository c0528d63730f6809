package com.sniper.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ImportRecommendation {
    IMPORT("import", "Importar"),
    DOMESTIC("national", "Comprar no Brasil"),
    EQUAL("equal", "Equivalente");

    private final String code;
    private final String displayName;

    ImportRecommendation(String code, String displayName) {
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
