package com.sniper.backend.services.finance;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.sniper.backend.enums.ProjectType;
import com.sniper.backend.services.finance.model.ProjectSuggestions;

/**
 * Sugere o que falta num projeto comparando os itens já adicionados com o catálogo
 * do tipo de projeto. Um item do catálogo conta como presente quando um nome contém
 * o outro, ignorando caixa e acentos ("Placa de Vídeo" cobre "Placa de Vídeo (GPU)").
 */
@Service
public class ProjectSuggestionEngine {

    static final int MAX_SUGGESTIONS = 5;
    static final int MAX_PRIORITY = 3;
    static final String CATALOG_REASONING = "Baseado no tipo de projeto selecionado.";

    public ProjectSuggestions suggest(String projectName, ProjectType projectType, List<String> existingItems) {
        ProjectType type = projectType == null ? ProjectType.OUTRO : projectType;
        List<String> existing = existingItems == null ? List.of() : List.copyOf(existingItems);
        List<String> existingKeys = existing.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(ProjectSuggestionEngine::matchKey)
                .toList();

        List<String> missing = type.getCatalog().stream()
                .filter(candidate -> !isCovered(matchKey(candidate), existingKeys))
                .toList();

        return ProjectSuggestions.builder()
                .projectName(projectName)
                .projectType(type)
                .existingItems(existing)
                .missingItems(missing)
                .suggestions(firstN(missing, MAX_SUGGESTIONS))
                .priorityOrder(firstN(missing, MAX_PRIORITY))
                .reasoning(CATALOG_REASONING)
                .build();
    }

    private static boolean isCovered(String candidateKey, List<String> existingKeys) {
        return existingKeys.stream()
                .anyMatch(existing -> existing.contains(candidateKey) || candidateKey.contains(existing));
    }

    static String matchKey(String name) {
        String decomposed = Normalizer.normalize(name.trim(), Normalizer.Form.NFD);
        return decomposed.replaceAll("\\p{M}", "").toLowerCase(Locale.ROOT);
    }

    private static List<String> firstN(List<String> items, int limit) {
        return List.copyOf(items.subList(0, Math.min(limit, items.size())));
    }
}
