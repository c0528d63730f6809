package com.sniper.backend.dto.project;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.sniper.backend.enums.ProjectType;
import com.sniper.backend.services.finance.model.ProjectItem;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ProjectSummaryRequest {

    @NotBlank(message = "Nome do projeto é obrigatório")
    private String name;

    /** pc, casa, eletro, moveis, eletronicos ou outro (padrão). */
    private String projectType;

    @DecimalMin(value = "0.0", message = "Orçamento mensal não pode ser negativo")
    private BigDecimal monthlyBudget;

    @Valid
    private List<ProjectItemRequest> items = new ArrayList<>();

    public ProjectType projectTypeOrDefault() {
        return ProjectType.fromCode(projectType);
    }

    public List<ProjectItem> toItems() {
        return items == null ? List.of() : items.stream().map(ProjectItemRequest::toItem).toList();
    }
}
