package fr.imt.scanzilla.scanzilla.business.model;

import java.util.List;

/**
 * Part of a workflow that is an exact copy of a catalog template.
 *
 * @param jobId       null for {@link DuplicateScope#WORKFLOW}
 * @param stepIndices zero-based indices of the copied steps, empty unless {@link DuplicateScope#STEPS}
 */
public record TemplateDuplicate(
        String workflowPath,
        DuplicateScope scope,
        String jobId,
        List<Integer> stepIndices,
        String fragmentId,
        String fragmentName
) {

    public TemplateDuplicate {
        stepIndices = List.copyOf(stepIndices);
    }

    public String describe() {
        return switch (scope) {
            case WORKFLOW -> "Workflow " + workflowPath + " is an exact copy of template '" + fragmentName + "'";
            case JOB -> "Job '" + jobId + "' of " + workflowPath + " is an exact copy of template '" + fragmentName + "'";
            case STEPS -> "Step(s) #" + (stepIndices.get(0) + 1) + "-#" + (stepIndices.get(stepIndices.size() - 1) + 1)
                    + " of job '" + jobId + "' in " + workflowPath + " are an exact copy of template '" + fragmentName + "'";
        };
    }
}
