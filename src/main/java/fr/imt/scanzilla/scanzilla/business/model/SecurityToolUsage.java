package fr.imt.scanzilla.scanzilla.business.model;

/**
 * A security tool found in a workflow, with the job and step that run it.
 */
public record SecurityToolUsage(String workflowPath, String jobId, String stepName, String tool) {
}
