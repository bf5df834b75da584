package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.AnalysisStatus;
import fr.imt.scanzilla.scanzilla.business.model.EnhancementPreview;
import fr.imt.scanzilla.scanzilla.business.model.InsertionTier;
import fr.imt.scanzilla.scanzilla.business.model.MergeResult;
import fr.imt.scanzilla.scanzilla.business.model.Recommendation;
import fr.imt.scanzilla.scanzilla.business.model.RepositoryAnalysis;
import fr.imt.scanzilla.scanzilla.business.model.RepositorySources;
import fr.imt.scanzilla.scanzilla.business.model.TemplateFragment;
import fr.imt.scanzilla.scanzilla.business.model.WorkflowFile;
import fr.imt.scanzilla.scanzilla.business.port.RepositorySourcePort;
import fr.imt.scanzilla.scanzilla.business.port.TemplateCatalogPort;
import fr.imt.scanzilla.scanzilla.exception.RecommendationNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Shows what a recommendation would change, without changing anything.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnhancementPreviewService {

    private final RepositorySourcePort repositorySourcePort;
    private final TemplateCatalogPort templateCatalogPort;
    private final RecommendationAssembler recommendationAssembler;

    public EnhancementPreview preview(String repository, String fragmentId) {
        RepositorySources sources = repositorySourcePort.fetch(repository);
        List<TemplateFragment> catalog = templateCatalogPort.findAll();
        RepositoryAnalysis analysis = recommendationAssembler.assemble(sources, catalog);
        if (analysis.status() != AnalysisStatus.ANALYZED) {
            throw new RecommendationNotFoundException(repository, fragmentId, analysis.failureReason());
        }

        Recommendation recommendation = analysis.recommendations().stream()
                .filter(candidate -> candidate.fragmentId().equals(fragmentId))
                .findFirst()
                .orElseThrow(() -> new RecommendationNotFoundException(repository, fragmentId));
        TemplateFragment fragment = catalog.stream()
                .filter(candidate -> candidate.id().equals(fragmentId))
                .findFirst()
                .orElseThrow(() -> new RecommendationNotFoundException(repository, fragmentId));

        MergeResult result = recommendationAssembler.materialize(sources, recommendation, fragment);
        String originalText = sources.workflowFiles().stream()
                .filter(file -> recommendation.insertionPoint().tier() != InsertionTier.NEW_PIPELINE_FILE)
                .filter(file -> file.path().equals(recommendation.targetPath()))
                .map(WorkflowFile::content)
                .findFirst()
                .orElse("");
        log.info("Preview of {} for {}: {} line(s) added to {}", fragmentId, repository,
                result.diff().insertionLength(), recommendation.targetPath());
        return new EnhancementPreview(repository, recommendation, originalText, result.merged().text(), result.diff());
    }
}
