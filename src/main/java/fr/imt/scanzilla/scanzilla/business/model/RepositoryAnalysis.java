package fr.imt.scanzilla.scanzilla.business.model;

import java.util.List;

/**
 * Outcome for one repository. {@code assessment} and {@code coverage} are null unless the
 * repository was analyzed.
 */
public record RepositoryAnalysis(
        String repository,
        AnalysisStatus status,
        String failureReason,
        AssessmentResult assessment,
        ScanCoverage coverage,
        List<Recommendation> recommendations
) {

    public RepositoryAnalysis {
        recommendations = List.copyOf(recommendations);
    }

    public static RepositoryAnalysis analyzed(String repository, AssessmentResult assessment, ScanCoverage coverage,
                                              List<Recommendation> recommendations) {
        return new RepositoryAnalysis(repository, AnalysisStatus.ANALYZED, null, assessment, coverage, recommendations);
    }

    public static RepositoryAnalysis failed(String repository, String reason) {
        return new RepositoryAnalysis(repository, AnalysisStatus.FAILED, reason, null, null, List.of());
    }

    public static RepositoryAnalysis skipped(String repository, String reason) {
        return new RepositoryAnalysis(repository, AnalysisStatus.SKIPPED, reason, null, null, List.of());
    }
}
