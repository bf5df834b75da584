package fr.imt.scanzilla.scanzilla.presentation.web.dto;

import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class AnalysisBatchResponse {
    private String id;
    private String status;
    private Instant createdAt;
    private int totalRepositories;
    private int completedRepositories;
    private List<RepositoryAnalysisResponse> analyses;
}
