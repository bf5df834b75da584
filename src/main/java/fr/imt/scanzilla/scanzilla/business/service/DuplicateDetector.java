package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.AssessmentDecision;
import fr.imt.scanzilla.scanzilla.business.model.DuplicateScope;
import fr.imt.scanzilla.scanzilla.business.model.TemplateDuplicate;
import fr.imt.scanzilla.scanzilla.business.model.TemplateFragment;
import fr.imt.scanzilla.scanzilla.business.model.WorkflowFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Finds workflows, jobs and step sequences that are exact copies of catalog templates.
 * <p>
 * Both sides are loaded as plain YAML values and compared structurally, so formatting, key
 * order and comments do not matter. Templates are compared as they would be rendered for the
 * repository, with and without the pull request SAST mode.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DuplicateDetector {

    private final FragmentRenderer fragmentRenderer;

    public List<TemplateDuplicate> detect(List<WorkflowFile> workflows, List<TemplateFragment> catalog,
                                          AssessmentDecision decision) {
        List<TemplateDuplicate> duplicates = new ArrayList<>();
        for (WorkflowFile workflow : workflows) {
            Optional<Object> loaded = load(workflow.content(), workflow.path());
            if (loaded.isEmpty() || !(loaded.get() instanceof Map<?, ?> root)) {
                continue;
            }
            for (TemplateFragment fragment : catalog) {
                for (Object template : renderings(fragment, decision)) {
                    List<TemplateDuplicate> found = switch (fragment.kind()) {
                        case PIPELINE -> workflowDuplicate(workflow.path(), root, template, fragment);
                        case JOB -> jobDuplicates(workflow.path(), root, template, fragment);
                        case STEP -> stepDuplicates(workflow.path(), root, template, fragment);
                    };
                    if (!found.isEmpty()) {
                        duplicates.addAll(found);
                        break;
                    }
                }
            }
        }
        if (!duplicates.isEmpty()) {
            log.debug("Found {} template duplicate(s)", duplicates.size());
        }
        return duplicates;
    }

    private List<Object> renderings(TemplateFragment fragment, AssessmentDecision decision) {
        Set<String> contents = new LinkedHashSet<>();
        contents.add(fragmentRenderer.render(fragment, decision, false).content());
        if (fragment.content() != null && fragment.content().contains(FragmentRenderer.SAST_TYPE_PLACEHOLDER)) {
            contents.add(fragmentRenderer.render(fragment, decision, true).content());
        }
        List<Object> templates = new ArrayList<>();
        contents.forEach(content -> load(content, "template " + fragment.id()).ifPresent(templates::add));
        return templates;
    }

    private static List<TemplateDuplicate> workflowDuplicate(String path, Map<?, ?> root, Object template,
                                                             TemplateFragment fragment) {
        if (!root.equals(template)) {
            return List.of();
        }
        return List.of(new TemplateDuplicate(path, DuplicateScope.WORKFLOW, null, List.of(), fragment.id(), fragment.name()));
    }

    private static List<TemplateDuplicate> jobDuplicates(String path, Map<?, ?> root, Object template,
                                                         TemplateFragment fragment) {
        if (!(template instanceof Map<?, ?> body)) {
            return List.of();
        }
        Object unwrapped = body.size() == 1 && body.values().iterator().next() instanceof Map<?, ?> inner ? inner : null;
        List<TemplateDuplicate> duplicates = new ArrayList<>();
        jobs(root).forEach((jobId, job) -> {
            if (body.equals(job) || (unwrapped != null && unwrapped.equals(job))) {
                duplicates.add(new TemplateDuplicate(path, DuplicateScope.JOB, String.valueOf(jobId), List.of(),
                        fragment.id(), fragment.name()));
            }
        });
        return duplicates;
    }

    /**
     * A step template is a single step or a list of steps; it matches consecutive steps of a job.
     */
    private static List<TemplateDuplicate> stepDuplicates(String path, Map<?, ?> root, Object template,
                                                          TemplateFragment fragment) {
        List<?> templateSteps = template instanceof List<?> list ? list : List.of(template);
        if (templateSteps.isEmpty()) {
            return List.of();
        }
        List<TemplateDuplicate> duplicates = new ArrayList<>();
        jobs(root).forEach((jobId, job) -> {
            if (!(job instanceof Map<?, ?> jobBody) || !(jobBody.get("steps") instanceof List<?> steps)) {
                return;
            }
            for (int i = 0; i + templateSteps.size() <= steps.size(); i++) {
                if (steps.subList(i, i + templateSteps.size()).equals(templateSteps)) {
                    List<Integer> indices = IntStream.range(i, i + templateSteps.size()).boxed().toList();
                    duplicates.add(new TemplateDuplicate(path, DuplicateScope.STEPS, String.valueOf(jobId), indices,
                            fragment.id(), fragment.name()));
                }
            }
        });
        return duplicates;
    }

    private static Map<?, ?> jobs(Map<?, ?> root) {
        return root.get("jobs") instanceof Map<?, ?> jobs ? jobs : Map.of();
    }

    private static Optional<Object> load(String content, String source) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(new Yaml().load(content));
        } catch (YAMLException e) {
            log.warn("Skipping duplicate detection for {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }
}
