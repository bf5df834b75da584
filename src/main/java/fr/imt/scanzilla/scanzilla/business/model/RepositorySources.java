package fr.imt.scanzilla.scanzilla.business.model;

import java.util.List;

/**
 * What the analysis needs from a repository: its workflow files and the paths of all its files.
 */
public record RepositorySources(String repository, List<WorkflowFile> workflowFiles, List<String> filePaths) {

    public RepositorySources {
        workflowFiles = List.copyOf(workflowFiles);
        filePaths = List.copyOf(filePaths);
    }
}
