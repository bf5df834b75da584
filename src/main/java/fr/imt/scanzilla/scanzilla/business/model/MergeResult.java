package fr.imt.scanzilla.scanzilla.business.model;

public record MergeResult(PipelineDocument merged, WorkflowDiff diff) {
}
