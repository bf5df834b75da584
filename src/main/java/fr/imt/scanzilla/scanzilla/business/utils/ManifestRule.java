package fr.imt.scanzilla.scanzilla.business.utils;

import java.util.List;
import java.util.Set;

/**
 * Manifest file names (or extensions) that reveal a package ecosystem.
 */
public record ManifestRule(
        String ecosystem,
        Set<String> fileNames,
        Set<String> extensions,
        List<String> languages,
        boolean managesDependencies
) {

    public boolean matches(String fileName) {
        return fileNames.contains(fileName) || extensions.stream().anyMatch(fileName::endsWith);
    }
}
