package fr.imt.scanzilla.scanzilla.business.model;

import java.util.List;

/**
 * A manifest file found in the repository and what it tells about the project.
 */
public record PackageManagerSignal(String path, String ecosystem, List<String> languages, boolean managesDependencies) {

    public PackageManagerSignal {
        languages = List.copyOf(languages);
    }

    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
