package com.sniper.backend.dto.project;

import java.util.ArrayList;
import java.util.List;

import com.sniper.backend.enums.ProjectType;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ProjectSuggestionRequest {

    @NotBlank(message = "Nome do projeto é obrigatório")
    private String name;

    @NotBlank(message = "Tipo de projeto é obrigatório")
    private String projectType;

    private List<String> existingItems = new ArrayList<>();

    public ProjectType projectTypeOrDefault() {
        return ProjectType.fromCode(projectType);
    }
}
