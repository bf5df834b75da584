package fr.imt.scanzilla.scanzilla.business.model;

/**
 * The document chosen for enhancement in a repository. For a new pipeline file the
 * document is {@link PipelineDocument#empty(String) empty} and carries the new file path.
 */
public record ResolvedTarget(PipelineDocument document, InsertionPoint point) {

    public String targetPath() {
        return document.path();
    }
}
