package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.AnalysisBatch;
import fr.imt.scanzilla.scanzilla.business.model.RepositoryAnalysis;
import fr.imt.scanzilla.scanzilla.business.model.RepositorySources;
import fr.imt.scanzilla.scanzilla.business.model.TemplateFragment;
import fr.imt.scanzilla.scanzilla.business.port.AnalysisStatusPublisherPort;
import fr.imt.scanzilla.scanzilla.business.port.RepositorySourcePort;
import fr.imt.scanzilla.scanzilla.business.port.TemplateCatalogPort;
import fr.imt.scanzilla.scanzilla.configuration.AnalysisExecutorConfiguration;
import fr.imt.scanzilla.scanzilla.exception.BatchNotFoundException;
import fr.imt.scanzilla.scanzilla.exception.RepositoryFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Analyzes many repositories in the background.
 * <p>
 * Each repository is one task on the analysis executor, so the executor's pool size bounds how
 * many repositories are fetched at once. A repository that fails is reported as such and does
 * not stop the others.
 */
@Service
@Slf4j
public class BatchAnalysisService {

    private final RepositorySourcePort repositorySourcePort;
    private final TemplateCatalogPort templateCatalogPort;
    private final RecommendationAssembler recommendationAssembler;
    private final AnalysisStatusPublisherPort statusPublisher;
    private final TaskExecutor analysisExecutor;

    private final Map<String, AnalysisBatch> batches = new ConcurrentHashMap<>();

    public BatchAnalysisService(RepositorySourcePort repositorySourcePort,
                                TemplateCatalogPort templateCatalogPort,
                                RecommendationAssembler recommendationAssembler,
                                AnalysisStatusPublisherPort statusPublisher,
                                @Qualifier(AnalysisExecutorConfiguration.ANALYSIS_EXECUTOR) TaskExecutor analysisExecutor) {
        this.repositorySourcePort = repositorySourcePort;
        this.templateCatalogPort = templateCatalogPort;
        this.recommendationAssembler = recommendationAssembler;
        this.statusPublisher = statusPublisher;
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * Starts the analysis of the given repositories and returns at once.
     * Repositories listed twice are analyzed once.
     */
    public AnalysisBatch start(List<String> repositories) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(repositories));
        List<TemplateFragment> catalog = templateCatalogPort.findAll();
        AnalysisBatch batch = new AnalysisBatch(UUID.randomUUID().toString(), distinct);
        batches.put(batch.getId(), batch);

        log.info("Batch {} started: {} repositories, {} template(s)", batch.getId(), distinct.size(), catalog.size());
        for (String repository : distinct) {
            analysisExecutor.execute(() -> analyse(batch, repository, catalog));
        }
        batch.completion().thenRun(() -> log.info("Batch {} finished with status {}", batch.getId(), batch.getStatus()));
        return batch;
    }

    public AnalysisBatch getBatch(String batchId) {
        AnalysisBatch batch = batches.get(batchId);
        if (batch == null) {
            throw new BatchNotFoundException(batchId);
        }
        return batch;
    }

    /**
     * Repositories whose fetch has not started are skipped; the ones in progress finish normally.
     */
    public AnalysisBatch cancel(String batchId) {
        AnalysisBatch batch = getBatch(batchId);
        batch.cancel();
        log.info("Batch {} cancelled after {} of {} repositories", batchId,
                batch.getCompletedCount(), batch.getRepositories().size());
        return batch;
    }

    private void analyse(AnalysisBatch batch, String repository, List<TemplateFragment> catalog) {
        if (batch.isCancelled()) {
            record(batch, RepositoryAnalysis.skipped(repository, "Batch cancelled before the analysis started"));
            return;
        }
        RepositoryAnalysis analysis;
        try {
            RepositorySources sources = repositorySourcePort.fetch(repository);
            analysis = recommendationAssembler.assemble(sources, catalog);
        } catch (RepositoryFetchException e) {
            log.warn("Repository {} could not be fetched: {}", repository, e.getMessage());
            analysis = RepositoryAnalysis.failed(repository, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while analysing {}", repository, e);
            analysis = RepositoryAnalysis.failed(repository, "Unexpected error: " + e.getMessage());
        }
        record(batch, analysis);
    }

    private void record(AnalysisBatch batch, RepositoryAnalysis analysis) {
        batch.complete(analysis);
        statusPublisher.publish(batch.getId(), analysis.repository(), analysis.status());
    }
}
