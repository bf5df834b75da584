package fr.imt.scanzilla.scanzilla.presentation.web.dto;

import lombok.Data;

import java.util.List;

@Data
public class RepositoryAnalysisResponse {
    private String repository;
    private String status;
    private String failureReason;
    private String assessmentDecision;
    private String confidence;
    private String primaryLanguage;
    private String assessmentReasoning;
    private List<String> packageManagers;
    private String coverageStatus;
    private List<SecurityToolResponse> securityTools;
    private List<TemplateDuplicateResponse> duplicates;
    private List<String> polarisConfigFiles;
    private boolean polarisInRoot;
    private List<RecommendationResponse> recommendations;
}
