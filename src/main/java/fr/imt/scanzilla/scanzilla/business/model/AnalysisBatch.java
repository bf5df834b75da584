package fr.imt.scanzilla.scanzilla.business.model;

import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A set of repositories analyzed together. Results are added by the analysis threads as
 * each repository finishes; at most one result is kept per repository.
 */
public class AnalysisBatch {

    public enum Status {
        RUNNING,
        COMPLETED,
        CANCELLED
    }

    @Getter
    private final String id;

    @Getter
    private final List<String> repositories;

    @Getter
    private final Instant createdAt = Instant.now();

    private final Map<String, RepositoryAnalysis> analyses = new ConcurrentHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    public AnalysisBatch(String id, List<String> repositories) {
        this.id = id;
        this.repositories = List.copyOf(repositories);
        if (this.repositories.isEmpty()) {
            completion.complete(null);
        }
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void complete(RepositoryAnalysis analysis) {
        analyses.putIfAbsent(analysis.repository(), analysis);
        if (analyses.size() >= repositories.size()) {
            completion.complete(null);
        }
    }

    /**
     * Completes once every repository has a result, skipped ones included.
     */
    public CompletableFuture<Void> completion() {
        return completion;
    }

    public Status getStatus() {
        if (isCancelled()) {
            return Status.CANCELLED;
        }
        return completion.isDone() ? Status.COMPLETED : Status.RUNNING;
    }

    public int getCompletedCount() {
        return analyses.size();
    }

    /**
     * Results so far, in the order the repositories were submitted.
     */
    public List<RepositoryAnalysis> getAnalyses() {
        return repositories.stream().map(analyses::get).filter(Objects::nonNull).toList();
    }
}
