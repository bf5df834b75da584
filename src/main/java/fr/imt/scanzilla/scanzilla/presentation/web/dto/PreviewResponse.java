package fr.imt.scanzilla.scanzilla.presentation.web.dto;

import lombok.Data;

import java.util.List;

@Data
public class PreviewResponse {
    private String repository;
    private String targetPath;
    private String originalWorkflow;
    private String enhancedWorkflow;
    private int insertionStart;
    private int insertionLength;
    private List<DiffLineResponse> diff;
    private RecommendationResponse recommendation;
}
