package com.sniper.backend.dto.imports;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ImportAnalysisRequest {

    @NotNull(message = "Preço em dólar é obrigatório")
    @DecimalMin(value = "0.0", message = "Preço em dólar não pode ser negativo")
    private BigDecimal priceUsd;

    @DecimalMin(value = "0.0", message = "Frete não pode ser negativo")
    private BigDecimal shippingUsd;

    /** Preço do mesmo produto no Brasil; sem ele só o custo de importação é calculado. */
    @DecimalMin(value = "0.0", message = "Preço nacional não pode ser negativo")
    private BigDecimal nationalPriceBrl;

    private Boolean remessaConforme;

    public boolean isRemessaConformeOrDefault() {
        return remessaConforme == null || remessaConforme;
    }
}
