package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import com.sniper.backend.exceptions.BadRequestException;
import com.sniper.backend.services.finance.FinanceValidation;

import lombok.Builder;

/**
 * Item de um projeto de compra (ex: "Placa de Vídeo" dentro de "Setup Gamer").
 */
@Builder
public record ProjectItem(
        String name,
        String store,
        BigDecimal cashPrice,
        BigDecimal installmentPrice,
        int installmentCount,
        int quantity,
        boolean interestFree
) {
    public ProjectItem {
        if (name == null || name.isBlank()) {
            throw new BadRequestException("Nome do item é obrigatório");
        }
        FinanceValidation.requireNonNegative(cashPrice, "Preço à vista");
        FinanceValidation.requireNonNegative(installmentPrice, "Preço parcelado");
        FinanceValidation.requireInstallmentCount(installmentCount);
        if (quantity < 1) {
            throw new BadRequestException("Quantidade deve ser pelo menos 1");
        }
    }
}
