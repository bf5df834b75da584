package fr.imt.scanzilla.scanzilla.business.model;

import fr.imt.scanzilla.scanzilla.business.utils.TextLines;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parsed view of a workflow file.
 * <p>
 * The text is kept as the list of its physical lines so that {@link #text()} gives back
 * the original bytes, and insertions can be done by splicing lines at an index.
 *
 * @param jobIndent column of the job keys under {@code jobs:}, -1 when there are no jobs
 * @param flowJobs  true when {@code jobs} is written in flow style
 */
public record PipelineDocument(
        String path,
        List<SourceLine> lines,
        String name,
        Trigger trigger,
        List<Job> jobs,
        int jobIndent,
        boolean flowJobs
) {

    private static final String DEFAULT_LINE_SEPARATOR = "\n";

    public PipelineDocument {
        lines = List.copyOf(lines);
        jobs = List.copyOf(jobs);
    }

    public static PipelineDocument empty(String path) {
        return new PipelineDocument(path, List.of(), null, Trigger.none(), List.of(), -1, false);
    }

    public String text() {
        return lines.stream().map(SourceLine::raw).collect(Collectors.joining());
    }

    public boolean hasJobs() {
        return !jobs.isEmpty();
    }

    public Optional<Job> findJob(String jobId) {
        return jobs.stream().filter(job -> job.id().equals(jobId)).findFirst();
    }

    /**
     * @return the first {@code \n}, {@code \r\n} or {@code \r} terminator found in the file, {@code "\n"} if none
     */
    public String lineSeparator() {
        return lines.stream()
                .map(SourceLine::terminator)
                .filter(TextLines::isCommonTerminator)
                .findFirst()
                .orElse(DEFAULT_LINE_SEPARATOR);
    }

    public Set<String> securityTools() {
        Set<String> tools = new LinkedHashSet<>();
        jobs.forEach(job -> tools.addAll(job.securityTools()));
        return tools;
    }

    public Set<String> languages() {
        Set<String> languages = new LinkedHashSet<>();
        jobs.forEach(job -> languages.addAll(job.languages()));
        return languages;
    }
}
