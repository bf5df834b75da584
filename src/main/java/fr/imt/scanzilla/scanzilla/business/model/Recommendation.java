package fr.imt.scanzilla.scanzilla.business.model;

import lombok.Builder;

import java.util.List;

@Builder
public record Recommendation(
        String fragmentId,
        String fragmentName,
        FragmentKind fragmentKind,
        String toolCategory,
        String targetPath,
        InsertionPoint insertionPoint,
        AssessmentDecision decision,
        String rationale,
        boolean languageMatch,
        int priority,
        boolean pullRequestOptimised,
        String pullRequestOptimisationReason,
        List<String> requiredSecrets,
        List<String> requiredVariables,
        List<String> packageManagers,
        boolean lowConfidence
) {
}
