package com.sniper.backend.services.finance.model;

/**
 * Resultado de {@code analyzeImport}: sempre traz o breakdown; a comparação só existe
 * quando um preço nacional foi informado.
 */
public record ImportAnalysis(
        ImportCostBreakdown breakdown,
        ImportComparison comparison
) {
    public boolean hasComparison() {
        return comparison != null;
    }
}
