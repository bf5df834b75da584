package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.AnalysisBatch;
import fr.imt.scanzilla.scanzilla.business.model.AnalysisStatus;
import fr.imt.scanzilla.scanzilla.business.model.RepositoryAnalysis;
import fr.imt.scanzilla.scanzilla.business.model.RepositorySources;
import fr.imt.scanzilla.scanzilla.business.port.AnalysisStatusPublisherPort;
import fr.imt.scanzilla.scanzilla.business.port.RepositorySourcePort;
import fr.imt.scanzilla.scanzilla.business.port.TemplateCatalogPort;
import fr.imt.scanzilla.scanzilla.exception.BatchNotFoundException;
import fr.imt.scanzilla.scanzilla.exception.RepositoryFetchException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import java.util.ArrayList;
import java.util.List;

import static fr.imt.scanzilla.scanzilla.business.service.FragmentFixtures.CATALOG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchAnalysisServiceTest {

    @Mock
    private RepositorySourcePort repositorySourcePort;

    @Mock
    private TemplateCatalogPort templateCatalogPort;

    @Mock
    private RecommendationAssembler recommendationAssembler;

    @Mock
    private AnalysisStatusPublisherPort statusPublisher;

    private BatchAnalysisService service(TaskExecutor executor) {
        return new BatchAnalysisService(repositorySourcePort, templateCatalogPort, recommendationAssembler,
                statusPublisher, executor);
    }

    private static RepositorySources sources(String repository) {
        return new RepositorySources(repository, List.of(), List.of("pom.xml"));
    }

    @Test
    void start_AnalysesEachRepositoryOnceAndPublishesProgress() {
        when(templateCatalogPort.findAll()).thenReturn(CATALOG);
        when(repositorySourcePort.fetch(anyString())).thenAnswer(invocation -> sources(invocation.getArgument(0)));
        when(recommendationAssembler.assemble(any(), eq(CATALOG))).thenAnswer(invocation -> {
            RepositorySources sources = invocation.getArgument(0);
            return RepositoryAnalysis.analyzed(sources.repository(), null, null, List.of());
        });

        AnalysisBatch batch = service(Runnable::run).start(List.of("acme/api", "acme/web", "acme/api"));

        assertThat(batch.getRepositories()).containsExactly("acme/api", "acme/web");
        assertThat(batch.getStatus()).isEqualTo(AnalysisBatch.Status.COMPLETED);
        assertThat(batch.completion()).isDone();
        assertThat(batch.getAnalyses()).extracting(RepositoryAnalysis::repository).containsExactly("acme/api", "acme/web");
        verify(templateCatalogPort, times(1)).findAll();
        verify(repositorySourcePort, times(1)).fetch("acme/api");
        verify(statusPublisher).publish(batch.getId(), "acme/api", AnalysisStatus.ANALYZED);
        verify(statusPublisher).publish(batch.getId(), "acme/web", AnalysisStatus.ANALYZED);
    }

    @Test
    void start_FailedRepository_DoesNotStopTheOthers() {
        when(templateCatalogPort.findAll()).thenReturn(CATALOG);
        when(repositorySourcePort.fetch("acme/api")).thenReturn(sources("acme/api"));
        when(repositorySourcePort.fetch("acme/gone"))
                .thenThrow(new RepositoryFetchException("acme/gone", "repository not found or not accessible"));
        when(recommendationAssembler.assemble(any(), any()))
                .thenReturn(RepositoryAnalysis.analyzed("acme/api", null, null, List.of()));

        AnalysisBatch batch = service(Runnable::run).start(List.of("acme/gone", "acme/api"));

        assertThat(batch.getAnalyses()).extracting(RepositoryAnalysis::status)
                .containsExactly(AnalysisStatus.FAILED, AnalysisStatus.ANALYZED);
        assertThat(batch.getAnalyses().get(0).failureReason()).contains("repository not found or not accessible");
        assertThat(batch.getStatus()).isEqualTo(AnalysisBatch.Status.COMPLETED);
        verify(statusPublisher).publish(batch.getId(), "acme/gone", AnalysisStatus.FAILED);
    }

    @Test
    void start_UnexpectedError_MarksRepositoryFailed() {
        when(templateCatalogPort.findAll()).thenReturn(CATALOG);
        when(repositorySourcePort.fetch("acme/api")).thenReturn(sources("acme/api"));
        when(recommendationAssembler.assemble(any(), any())).thenThrow(new IllegalStateException("boom"));

        AnalysisBatch batch = service(Runnable::run).start(List.of("acme/api"));

        assertThat(batch.getAnalyses()).singleElement().satisfies(analysis -> {
            assertThat(analysis.status()).isEqualTo(AnalysisStatus.FAILED);
            assertThat(analysis.failureReason()).isEqualTo("Unexpected error: boom");
        });
    }

    @Test
    void cancel_PendingRepositoriesAreSkipped() {
        List<Runnable> queued = new ArrayList<>();
        when(templateCatalogPort.findAll()).thenReturn(CATALOG);
        BatchAnalysisService service = service(queued::add);

        AnalysisBatch batch = service.start(List.of("acme/api", "acme/web"));
        assertThat(batch.getStatus()).isEqualTo(AnalysisBatch.Status.RUNNING);

        service.cancel(batch.getId());
        queued.forEach(Runnable::run);

        assertThat(batch.getStatus()).isEqualTo(AnalysisBatch.Status.CANCELLED);
        assertThat(batch.completion()).isDone();
        assertThat(batch.getAnalyses()).extracting(RepositoryAnalysis::status)
                .containsExactly(AnalysisStatus.SKIPPED, AnalysisStatus.SKIPPED);
        verify(repositorySourcePort, never()).fetch(anyString());
        verify(statusPublisher, times(2)).publish(eq(batch.getId()), anyString(), eq(AnalysisStatus.SKIPPED));
    }

    @Test
    void getBatch_KnownAndUnknownIds() {
        when(templateCatalogPort.findAll()).thenReturn(List.of());
        BatchAnalysisService service = service(Runnable::run);
        AnalysisBatch batch = service.start(List.of());

        assertThat(service.getBatch(batch.getId())).isSameAs(batch);
        assertThat(batch.getStatus()).isEqualTo(AnalysisBatch.Status.COMPLETED);
        assertThatThrownBy(() -> service.getBatch("missing"))
                .isInstanceOf(BatchNotFoundException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> service.cancel("missing")).isInstanceOf(BatchNotFoundException.class);
    }
}
