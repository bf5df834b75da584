package fr.imt.scanzilla.scanzilla.presentation.web.dto;

import lombok.Data;

import java.util.List;

@Data
public class RecommendationResponse {
    private String fragmentId;
    private String fragmentName;
    private String fragmentKind;
    private String toolCategory;
    private String targetPath;
    private String insertionTier;
    private String targetJob;
    private String afterJob;
    private Integer afterStep;
    private String insertionDescription;
    private String assessmentDecision;
    private String rationale;
    private boolean languageMatch;
    private boolean pullRequestOptimised;
    private String pullRequestOptimisationReason;
    private List<String> requiredSecrets;
    private List<String> requiredVariables;
    private List<String> packageManagers;
    private boolean lowConfidence;
}
