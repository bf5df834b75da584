package fr.imt.scanzilla.scanzilla.business.model;

public enum AnalysisStatus {
    ANALYZED,
    FAILED,
    SKIPPED
}
