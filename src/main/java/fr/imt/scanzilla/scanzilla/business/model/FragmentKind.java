package fr.imt.scanzilla.scanzilla.business.model;

import lombok.Getter;

/**
 * Shape of a template fragment, stored in the catalog as {@code templateType}.
 */
@Getter
public enum FragmentKind {
    PIPELINE("workflow"),
    JOB("job"),
    STEP("step");

    private final String templateType;

    FragmentKind(String templateType) {
        this.templateType = templateType;
    }

    public static FragmentKind fromTemplateType(String templateType) {
        for (FragmentKind kind : values()) {
            if (kind.templateType.equalsIgnoreCase(templateType) || kind.name().equalsIgnoreCase(templateType)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown template type: " + templateType);
    }
}
