package com.sniper.backend.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Alíquotas de importação (Remessa Conforme) e ICMS.
 */
@ConfigurationProperties(prefix = "sniper.imports")
public record ImportTaxProperties(
        BigDecimal icmsRate,
        BigDecimal reducedImportTaxRate,
        BigDecimal standardImportTaxRate,
        BigDecimal reducedTaxThresholdUsd
) {
    public ImportTaxProperties {
        if (icmsRate == null) {
            icmsRate = new BigDecimal("0.17");
        }
        if (reducedImportTaxRate == null) {
            reducedImportTaxRate = new BigDecimal("0.20");
        }
        if (standardImportTaxRate == null) {
            standardImportTaxRate = new BigDecimal("0.60");
        }
        if (reducedTaxThresholdUsd == null) {
            reducedTaxThresholdUsd = new BigDecimal("50.00");
        }
    }

    public static ImportTaxProperties defaults() {
        return new ImportTaxProperties(null, null, null, null);
    }
}
