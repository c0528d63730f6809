package com.sniper.backend.dto.project;

import java.math.BigDecimal;

import com.sniper.backend.services.finance.model.ProjectItem;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ProjectItemRequest {

    @NotBlank(message = "Nome do item é obrigatório")
    private String name;

    private String store;

    @NotNull(message = "Preço à vista é obrigatório")
    @DecimalMin(value = "0.0", message = "Preço à vista não pode ser negativo")
    private BigDecimal cashPrice;

    @NotNull(message = "Preço parcelado é obrigatório")
    @DecimalMin(value = "0.0", message = "Preço parcelado não pode ser negativo")
    private BigDecimal installmentPrice;

    @Min(value = 1, message = "Número de parcelas deve ser pelo menos 1")
    @Max(value = 360, message = "Número de parcelas deve ser no máximo 360")
    private Integer installmentCount;

    @Min(value = 1, message = "Quantidade deve ser pelo menos 1")
    private Integer quantity;

    private Boolean interestFree;

    public ProjectItem toItem() {
        return ProjectItem.builder()
                .name(name)
                .store(store)
                .cashPrice(cashPrice)
                .installmentPrice(installmentPrice)
                .installmentCount(installmentCount == null ? 1 : installmentCount)
                .quantity(quantity == null ? 1 : quantity)
                .interestFree(interestFree == null || interestFree)
                .build();
    }
}
