package com.sniper.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sniper.backend.dto.ApiResponse;
import com.sniper.backend.dto.project.ProjectSuggestionRequest;
import com.sniper.backend.dto.project.ProjectSummaryRequest;
import com.sniper.backend.services.finance.FinanceEngine;
import com.sniper.backend.services.finance.model.ProjectSuggestions;
import com.sniper.backend.services.finance.model.ProjectSummary;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
@Slf4j
public class ProjectController {

    private final FinanceEngine financeEngine;

    @PostMapping("/summary")
    public ResponseEntity<ApiResponse<ProjectSummary>> summary(@Valid @RequestBody ProjectSummaryRequest request) {
        ProjectSummary summary = financeEngine.summarizeProject(
                request.getName(), request.projectTypeOrDefault(), request.toItems(), request.getMonthlyBudget());
        log.info("[Projects] name={}, type={}, items={}, overBudget={}",
                summary.name(), summary.projectType(), summary.items().size(), summary.overBudget());
        return ResponseEntity.ok(ApiResponse.success(summary, "Resumo do projeto calculado"));
    }

    @PostMapping("/suggestions")
    public ResponseEntity<ApiResponse<ProjectSuggestions>> suggestions(@Valid @RequestBody ProjectSuggestionRequest request) {
        ProjectSuggestions suggestions = financeEngine.suggestProjectItems(
                request.getName(), request.projectTypeOrDefault(), request.getExistingItems());
        log.info("[Projects] suggestions name={}, type={}, missing={}",
                suggestions.projectName(), suggestions.projectType(), suggestions.missingItems().size());
        return ResponseEntity.ok(ApiResponse.success(suggestions, "Sugestões do projeto geradas"));
    }
}
