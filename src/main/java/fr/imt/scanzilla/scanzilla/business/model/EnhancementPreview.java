package fr.imt.scanzilla.scanzilla.business.model;

public record EnhancementPreview(
        String repository,
        Recommendation recommendation,
        String originalText,
        String mergedText,
        WorkflowDiff diff
) {
}
