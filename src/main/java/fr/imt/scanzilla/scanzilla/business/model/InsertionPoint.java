package fr.imt.scanzilla.scanzilla.business.model;

/**
 * Where a fragment goes. Which of {@code targetJob}, {@code afterJob} and {@code afterStep}
 * are set depends on the tier:
 * <ul>
 *     <li>{@link InsertionTier#APPEND_STEP}: {@code targetJob}, and {@code afterStep} (step index) when known</li>
 *     <li>{@link InsertionTier#APPEND_JOB}: {@code afterJob} when known</li>
 *     <li>otherwise none</li>
 * </ul>
 */
public record InsertionPoint(
        InsertionTier tier,
        String targetJob,
        String afterJob,
        Integer afterStep,
        String reasoning
) {

    public static InsertionPoint newPipelineFile(String reasoning) {
        return new InsertionPoint(InsertionTier.NEW_PIPELINE_FILE, null, null, null, reasoning);
    }

    public static InsertionPoint appendJob(String afterJob, String reasoning) {
        return new InsertionPoint(InsertionTier.APPEND_JOB, null, afterJob, null, reasoning);
    }

    public static InsertionPoint appendStep(String targetJob, Integer afterStep, String reasoning) {
        return new InsertionPoint(InsertionTier.APPEND_STEP, targetJob, null, afterStep, reasoning);
    }

    public static InsertionPoint alreadyCovered(String reasoning) {
        return new InsertionPoint(InsertionTier.ALREADY_COVERED, null, null, null, reasoning);
    }

    public String describe() {
        return switch (tier) {
            case NEW_PIPELINE_FILE -> "Create a new workflow file";
            case APPEND_JOB -> afterJob == null
                    ? "Add a new job at the end of the workflow"
                    : "Add a new job after job '" + afterJob + "'";
            case APPEND_STEP -> afterStep == null
                    ? "Add a step at the end of job '" + targetJob + "'"
                    : "Add a step to job '" + targetJob + "' after step #" + (afterStep + 1);
            case ALREADY_COVERED -> "Every job already runs a security scan";
        };
    }
}
