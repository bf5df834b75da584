package fr.imt.scanzilla.scanzilla.business.model;

public enum DuplicateScope {
    WORKFLOW,
    JOB,
    STEPS
}
