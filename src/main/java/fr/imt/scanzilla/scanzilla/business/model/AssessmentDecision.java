package fr.imt.scanzilla.scanzilla.business.model;

import lombok.Getter;

public enum AssessmentDecision {
    SAST("SAST", true, false),
    SCA("SCA", false, true),
    SAST_SCA("SAST,SCA", true, true);

    @Getter
    private final String polarisValue;
    private final boolean staticAnalysis;
    private final boolean compositionAnalysis;

    AssessmentDecision(String polarisValue, boolean staticAnalysis, boolean compositionAnalysis) {
        this.polarisValue = polarisValue;
        this.staticAnalysis = staticAnalysis;
        this.compositionAnalysis = compositionAnalysis;
    }

    public boolean includesStaticAnalysis() {
        return staticAnalysis;
    }

    public boolean includesCompositionAnalysis() {
        return compositionAnalysis;
    }

    public boolean includes(ScanCategory category) {
        return category == ScanCategory.SAST ? staticAnalysis : compositionAnalysis;
    }
}
