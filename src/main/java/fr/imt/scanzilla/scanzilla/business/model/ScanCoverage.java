package fr.imt.scanzilla.scanzilla.business.model;

import java.util.List;

/**
 * What a repository already has in place for security scanning.
 *
 * @param polarisConfigFiles {@code polaris.yml} or {@code polaris.yaml} files at the repository root
 */
public record ScanCoverage(
        CoverageStatus status,
        List<SecurityToolUsage> tools,
        List<TemplateDuplicate> duplicates,
        List<String> polarisConfigFiles
) {

    public ScanCoverage {
        tools = List.copyOf(tools);
        duplicates = List.copyOf(duplicates);
        polarisConfigFiles = List.copyOf(polarisConfigFiles);
    }

    public boolean hasPolarisInRoot() {
        return !polarisConfigFiles.isEmpty();
    }
}
