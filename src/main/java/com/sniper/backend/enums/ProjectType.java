package com.sniper.backend.enums;

import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonValue;
import com.sniper.backend.exceptions.BadRequestException;

/**
 * Tipo de projeto de compra e o catálogo de itens que costumam compô-lo.
 */
public enum ProjectType {
    PC("pc", "PC / Setup Gamer", List.of(
            "Placa de Vídeo (GPU)",
            "Processador (CPU)",
            "Memória RAM",
            "SSD/HD",
            "Placa Mãe",
            "Fonte",
            "Gabinete",
            "Cooler",
            "Monitor",
            "Teclado",
            "Mouse",
            "Headset")),
    CASA("casa", "Casa / Decoração", List.of(
            "Sofá",
            "Mesa de Jantar",
            "Cama",
            "Guarda-roupa",
            "TV",
            "Ar Condicionado",
            "Geladeira",
            "Fogão",
            "Micro-ondas")),
    ELETRO("eletro", "Eletrodomésticos", List.of(
            "Geladeira",
            "Fogão",
            "Máquina de Lavar",
            "Micro-ondas",
            "Ar Condicionado",
            "Aspirador de Pó")),
    MOVEIS("moveis", "Móveis", List.of(
            "Sofá",
            "Cama",
            "Mesa",
            "Cadeiras",
            "Guarda-roupa",
            "Estante",
            "Rack")),
    ELETRONICOS("eletronicos", "Eletrônicos", List.of(
            "Smartphone",
            "Tablet",
            "Notebook",
            "Smart TV",
            "Fone de Ouvido",
            "Smartwatch")),
    OUTRO("outro", "Outro", List.of());

    private final String code;
    private final String displayName;
    private final List<String> catalog;

    ProjectType(String code, String displayName, List<String> catalog) {
        this.code = code;
        this.displayName = displayName;
        this.catalog = catalog;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getCatalog() {
        return catalog;
    }

    /** Sem tipo informado vale {@code outro}; códigos desconhecidos são rejeitados. */
    public static ProjectType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return OUTRO;
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new BadRequestException("Tipo de projeto inválido: " + code));
    }
}
