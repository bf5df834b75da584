package fr.imt.scanzilla.scanzilla.business.model;

public record WorkflowFile(String path, String content) {
}
