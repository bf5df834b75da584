package fr.imt.scanzilla.scanzilla.business.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A job of a workflow with its ordered steps.
 *
 * @param stepIndent column of the {@code -} marker of the step items, -1 when the job has no steps
 * @param flowSteps  true when {@code steps} is written in flow style ({@code [ ... ]})
 */
public record Job(
        String id,
        String name,
        LineSpan span,
        List<Step> steps,
        int stepIndent,
        boolean flowSteps
) {

    public Job {
        steps = List.copyOf(steps);
    }

    public boolean hasBuildStep() {
        return steps.stream().anyMatch(Step::buildStep);
    }

    public boolean hasTestStep() {
        return steps.stream().anyMatch(Step::testStep);
    }

    public boolean hasScanStep() {
        return steps.stream().anyMatch(Step::scanStep);
    }

    public Optional<Step> lastBuildStep() {
        Step last = null;
        for (Step step : steps) {
            if (step.buildStep()) {
                last = step;
            }
        }
        return Optional.ofNullable(last);
    }

    public Optional<Step> lastStep() {
        return steps.isEmpty() ? Optional.empty() : Optional.of(steps.get(steps.size() - 1));
    }

    public Set<String> buildTools() {
        return collect(steps.stream().map(Step::buildTool).toList());
    }

    public Set<String> languages() {
        return collect(steps.stream().map(Step::language).toList());
    }

    public Set<String> securityTools() {
        return collect(steps.stream().map(Step::securityTool).toList());
    }

    private static Set<String> collect(List<String> values) {
        Set<String> result = new LinkedHashSet<>();
        values.stream().filter(Objects::nonNull).forEach(result::add);
        return result;
    }
}
