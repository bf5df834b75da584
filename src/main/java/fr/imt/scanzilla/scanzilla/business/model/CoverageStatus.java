package fr.imt.scanzilla.scanzilla.business.model;

/**
 * How far a repository is from running security scans in CI.
 */
public enum CoverageStatus {
    /** At least one workflow step already runs a security tool. */
    CONFIGURED,
    /** Workflows exist but none of them scans. */
    NEEDS_ENHANCEMENT,
    /** The repository has no workflow to enhance. */
    NEEDS_NEW_WORKFLOW
}
