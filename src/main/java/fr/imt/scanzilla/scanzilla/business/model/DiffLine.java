package fr.imt.scanzilla.scanzilla.business.model;

/**
 * @param originalLineNumber 1-based, null for added lines
 * @param mergedLineNumber   1-based
 */
public record DiffLine(Type type, Integer originalLineNumber, Integer mergedLineNumber, String text) {

    public enum Type {
        UNCHANGED,
        ADDED
    }

    public static DiffLine unchanged(int originalLineNumber, int mergedLineNumber, String text) {
        return new DiffLine(Type.UNCHANGED, originalLineNumber, mergedLineNumber, text);
    }

    public static DiffLine added(int mergedLineNumber, String text) {
        return new DiffLine(Type.ADDED, null, mergedLineNumber, text);
    }
}
