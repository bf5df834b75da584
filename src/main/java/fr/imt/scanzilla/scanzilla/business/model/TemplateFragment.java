package fr.imt.scanzilla.scanzilla.business.model;

import lombok.Builder;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * A reusable piece of workflow YAML offered by the template catalog.
 *
 * @param category  tool category such as {@code polaris}, {@code coverity} or {@code blackduck_sca}
 * @param languages applicable languages, empty when the fragment is language agnostic
 * @param priority  lower is preferred
 */
@Builder(toBuilder = true)
public record TemplateFragment(
        String id,
        String name,
        String description,
        FragmentKind kind,
        String content,
        String category,
        Set<ScanCategory> scanCategories,
        List<String> languages,
        List<String> requiredSecrets,
        List<String> requiredVariables,
        int priority
) {

    public TemplateFragment {
        scanCategories = scanCategories == null ? Set.of() : Set.copyOf(scanCategories);
        languages = languages == null ? List.of() : List.copyOf(languages);
        requiredSecrets = requiredSecrets == null ? List.of() : List.copyOf(requiredSecrets);
        requiredVariables = requiredVariables == null ? List.of() : List.copyOf(requiredVariables);
    }

    public TemplateFragment withContent(String renderedContent) {
        return toBuilder().content(renderedContent).build();
    }

    public boolean isLanguageAgnostic() {
        return languages.isEmpty();
    }

    public boolean supportsAnyLanguage(Collection<String> candidates) {
        return candidates.stream().anyMatch(candidate -> languages.stream().anyMatch(candidate::equalsIgnoreCase));
    }

    public boolean covers(AssessmentDecision decision) {
        return scanCategories.stream().anyMatch(decision::includes);
    }
}
