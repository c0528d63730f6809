package com.sniper.backend.services.finance.model;

import java.util.List;

import com.sniper.backend.enums.ProjectType;

import lombok.Builder;

/**
 * Itens do catálogo do tipo de projeto que ainda não aparecem no projeto.
 */
@Builder
public record ProjectSuggestions(
        String projectName,
        ProjectType projectType,
        List<String> existingItems,
        List<String> missingItems,
        List<String> suggestions,
        List<String> priorityOrder,
        String reasoning
) {
}
