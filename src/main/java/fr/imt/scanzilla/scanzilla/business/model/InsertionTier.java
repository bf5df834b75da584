package fr.imt.scanzilla.scanzilla.business.model;

import java.util.Optional;

public enum InsertionTier {
    NEW_PIPELINE_FILE(FragmentKind.PIPELINE),
    APPEND_JOB(FragmentKind.JOB),
    APPEND_STEP(FragmentKind.STEP),
    ALREADY_COVERED(null);

    private final FragmentKind acceptedKind;

    InsertionTier(FragmentKind acceptedKind) {
        this.acceptedKind = acceptedKind;
    }

    /**
     * @return the only fragment kind that can be merged at this tier, empty for {@link #ALREADY_COVERED}
     */
    public Optional<FragmentKind> acceptedKind() {
        return Optional.ofNullable(acceptedKind);
    }
}
