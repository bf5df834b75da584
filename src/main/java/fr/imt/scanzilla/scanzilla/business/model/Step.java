package fr.imt.scanzilla.scanzilla.business.model;

import lombok.Builder;

/**
 * A single step of a job, classified by {@link fr.imt.scanzilla.scanzilla.business.utils.StepIndicators}.
 * {@code buildTool}, {@code language} and {@code securityTool} are null when nothing was detected.
 */
@Builder
public record Step(
        int index,
        String id,
        String name,
        String uses,
        String run,
        LineSpan span,
        boolean buildStep,
        boolean testStep,
        boolean scanStep,
        String buildTool,
        String language,
        String securityTool
) {
}
