package fr.imt.scanzilla.scanzilla.infrastructure.persistence.repository;

import fr.imt.scanzilla.scanzilla.business.model.FragmentKind;
import fr.imt.scanzilla.scanzilla.business.model.ScanCategory;
import fr.imt.scanzilla.scanzilla.business.model.TemplateFragment;
import fr.imt.scanzilla.scanzilla.business.port.TemplateCatalogPort;
import fr.imt.scanzilla.scanzilla.infrastructure.persistence.TemplateFragmentDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Component
@Slf4j
@RequiredArgsConstructor
public class MongoTemplateCatalogAdapter implements TemplateCatalogPort {

    private final TemplateFragmentRepository templateFragmentRepository;

    @Override
    public List<TemplateFragment> findAll() {
        List<TemplateFragment> fragments = new ArrayList<>();
        for (TemplateFragmentDocument document : templateFragmentRepository.findAll()) {
            toFragment(document).ifPresent(fragments::add);
        }
        return fragments;
    }

    /**
     * Records with an unknown template type are left out of the catalog.
     */
    static Optional<TemplateFragment> toFragment(TemplateFragmentDocument document) {
        FragmentKind kind;
        try {
            kind = FragmentKind.fromTemplateType(document.getTemplateType());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring template {}: {}", document.getId(), e.getMessage());
            return Optional.empty();
        }
        return Optional.of(TemplateFragment.builder()
                .id(document.getId())
                .name(document.getName())
                .description(document.getDescription())
                .kind(kind)
                .content(document.getContent() == null ? "" : document.getContent())
                .category(document.getCategory())
                .scanCategories(scanCategories(document))
                .languages(document.getCompatibleLanguages())
                .requiredSecrets(document.getRequiredSecrets())
                .requiredVariables(document.getRequiredVariables())
                .priority(document.getPriority())
                .build());
    }

    /**
     * Without explicit categories, black duck templates scan dependencies and every other tool scans code.
     */
    private static Set<ScanCategory> scanCategories(TemplateFragmentDocument document) {
        Set<ScanCategory> categories = EnumSet.noneOf(ScanCategory.class);
        if (document.getScanningCategories() != null) {
            for (String category : document.getScanningCategories()) {
                String value = category.trim().toUpperCase(Locale.ROOT);
                if (value.equals("SAST") || value.equals("SCA")) {
                    categories.add(ScanCategory.valueOf(value));
                }
            }
        }
        if (categories.isEmpty()) {
            String category = document.getCategory() == null ? "" : document.getCategory().toLowerCase(Locale.ROOT);
            categories.add(category.startsWith("blackduck") || category.startsWith("black_duck")
                    ? ScanCategory.SCA
                    : ScanCategory.SAST);
        }
        return categories;
    }
}
