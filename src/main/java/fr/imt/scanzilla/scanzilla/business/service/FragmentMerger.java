package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.DiffLine;
import fr.imt.scanzilla.scanzilla.business.model.FragmentKind;
import fr.imt.scanzilla.scanzilla.business.model.InsertionPoint;
import fr.imt.scanzilla.scanzilla.business.model.Job;
import fr.imt.scanzilla.scanzilla.business.model.MergeResult;
import fr.imt.scanzilla.scanzilla.business.model.PipelineDocument;
import fr.imt.scanzilla.scanzilla.business.model.SourceLine;
import fr.imt.scanzilla.scanzilla.business.model.Step;
import fr.imt.scanzilla.scanzilla.business.model.TemplateFragment;
import fr.imt.scanzilla.scanzilla.business.model.WorkflowDiff;
import fr.imt.scanzilla.scanzilla.business.utils.TextLines;
import fr.imt.scanzilla.scanzilla.exception.FragmentMergeException;
import fr.imt.scanzilla.scanzilla.exception.PipelineParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Splices a template fragment into a workflow as plain text.
 * <p>
 * The fragment is re-indented to the place it goes and inserted as one block of lines; every
 * other line of the workflow is kept as it is. The result is parsed again so that a fragment
 * which would break the workflow is rejected instead of returned.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FragmentMerger {

    /**
     * Keys that make a single-entry mapping a job body rather than a {@code job-id: {...}} wrapper.
     */
    private static final Set<String> JOB_KEYS = Set.of(
            "runs-on", "steps", "needs", "uses", "name", "if", "env", "strategy", "permissions",
            "container", "services", "outputs", "timeout-minutes", "environment", "concurrency",
            "defaults", "continue-on-error", "with", "secrets");

    private static final String GENERATED_JOB_PREFIX = "security-scan";
    private static final int DEFAULT_INDENT = 2;

    private final PipelineParser pipelineParser;

    public MergeResult merge(PipelineDocument document, TemplateFragment fragment, InsertionPoint point) {
        FragmentKind accepted = point.tier().acceptedKind()
                .orElseThrow(() -> new FragmentMergeException(fragment.id(), "no fragment can be inserted when " + point.tier()));
        if (fragment.kind() != accepted) {
            throw new FragmentMergeException(fragment.id(),
                    fragment.kind() + " fragment cannot be used for " + point.tier() + ", expected " + accepted);
        }
        Node root = compose(fragment);
        return switch (point.tier()) {
            case NEW_PIPELINE_FILE -> newPipelineFile(document, fragment, root);
            case APPEND_JOB -> appendJob(document, fragment, root, point);
            case APPEND_STEP -> appendStep(document, fragment, root, point);
            case ALREADY_COVERED -> throw new FragmentMergeException(fragment.id(), "workflow is already covered");
        };
    }

    /**
     * The workflow file is new: the fragment is its whole content and every line is added.
     */
    private MergeResult newPipelineFile(PipelineDocument document, TemplateFragment fragment, Node root) {
        if (!(root instanceof MappingNode)) {
            throw new FragmentMergeException(fragment.id(), "a workflow template must be a mapping");
        }
        PipelineDocument merged = reparse(fragment, document.path(), fragment.content());
        List<DiffLine> diff = new ArrayList<>();
        for (int i = 0; i < merged.lines().size(); i++) {
            diff.add(DiffLine.added(i + 1, merged.lines().get(i).content()));
        }
        return new MergeResult(merged, new WorkflowDiff(diff, 0, diff.size()));
    }

    private MergeResult appendStep(PipelineDocument document, TemplateFragment fragment, Node root, InsertionPoint point) {
        Job job = document.findJob(point.targetJob())
                .orElseThrow(() -> new FragmentMergeException(fragment.id(), "job '" + point.targetJob() + "' not found"));
        if (job.flowSteps()) {
            throw new FragmentMergeException(fragment.id(), "steps of job '" + job.id() + "' are written in flow style");
        }
        if (job.steps().isEmpty()) {
            throw new FragmentMergeException(fragment.id(), "job '" + job.id() + "' has no steps");
        }
        Step anchor = anchorStep(fragment, job, point.afterStep());

        FragmentText text = FragmentText.of(fragment.content());
        int indent = job.stepIndent();
        List<String> block;
        int items;
        if (root instanceof SequenceNode sequence) {
            if (sequence.getFlowStyle() == DumperOptions.FlowStyle.FLOW) {
                throw new FragmentMergeException(fragment.id(), "a step list template must be in block style");
            }
            if (sequence.getValue().isEmpty() || !sequence.getValue().stream().allMatch(MappingNode.class::isInstance)) {
                throw new FragmentMergeException(fragment.id(), "a step list template must contain step mappings");
            }
            block = reindent(text.lines(), text.baseIndent(), indent);
            items = sequence.getValue().size();
        } else if (root instanceof MappingNode) {
            block = asSequenceItem(text, indent);
            items = 1;
        } else {
            throw new FragmentMergeException(fragment.id(), "a step template must be a mapping or a list of mappings");
        }

        MergeResult result = splice(document, fragment, anchor.span().endLine() + 1, block);
        int stepCount = result.merged().findJob(job.id()).map(merged -> merged.steps().size()).orElse(-1);
        if (stepCount != job.steps().size() + items) {
            throw new FragmentMergeException(fragment.id(), "inserted lines are not read back as steps of job '" + job.id() + "'");
        }
        return result;
    }

    private MergeResult appendJob(PipelineDocument document, TemplateFragment fragment, Node root, InsertionPoint point) {
        if (document.flowJobs()) {
            throw new FragmentMergeException(fragment.id(), "jobs of " + document.path() + " are written in flow style");
        }
        if (!document.hasJobs()) {
            throw new FragmentMergeException(fragment.id(), document.path() + " has no jobs to append to");
        }
        if (!(root instanceof MappingNode mapping) || mapping.getFlowStyle() == DumperOptions.FlowStyle.FLOW) {
            throw new FragmentMergeException(fragment.id(), "a job template must be a block mapping");
        }
        Job anchor = point.afterJob() == null
                ? document.jobs().get(document.jobs().size() - 1)
                : document.findJob(point.afterJob())
                .orElseThrow(() -> new FragmentMergeException(fragment.id(), "job '" + point.afterJob() + "' not found"));

        FragmentText text = FragmentText.of(fragment.content());
        int jobIndent = document.jobIndent();
        List<String> block = new ArrayList<>();
        block.add("");
        String jobId;
        if (isWrappedJob(mapping)) {
            NodeTuple entry = mapping.getValue().get(0);
            String declaredId = ((ScalarNode) entry.getKeyNode()).getValue();
            jobId = uniqueJobId(document, declaredId);
            List<String> lines = reindent(text.lines(), text.baseIndent(), jobIndent);
            if (!jobId.equals(declaredId)) {
                renameJobKey(text, entry.getKeyNode(), lines, jobIndent, jobId);
            }
            block.addAll(lines);
        } else {
            jobId = uniqueJobId(document, generatedJobId(fragment));
            block.add(" ".repeat(jobIndent) + jobId + ":");
            block.addAll(reindent(text.lines(), text.baseIndent(), jobIndent + (jobIndent > 0 ? jobIndent : DEFAULT_INDENT)));
        }

        MergeResult result = splice(document, fragment, anchor.span().endLine() + 1, block);
        if (result.merged().jobs().size() != document.jobs().size() + 1 || result.merged().findJob(jobId).isEmpty()) {
            throw new FragmentMergeException(fragment.id(), "inserted lines are not read back as job '" + jobId + "'");
        }
        return result;
    }

    private MergeResult splice(PipelineDocument document, TemplateFragment fragment, int insertAt, List<String> block) {
        List<SourceLine> original = document.lines();
        String separator = document.lineSeparator();

        List<SourceLine> lines = new ArrayList<>(original.size() + block.size());
        lines.addAll(original.subList(0, insertAt));
        if (insertAt > 0 && !lines.get(insertAt - 1).isTerminated()) {
            lines.set(insertAt - 1, new SourceLine(lines.get(insertAt - 1).content(), separator));
        }
        block.forEach(line -> lines.add(new SourceLine(line, separator)));
        lines.addAll(original.subList(insertAt, original.size()));

        String mergedText = lines.stream().map(SourceLine::raw).collect(Collectors.joining());
        PipelineDocument merged = reparse(fragment, document.path(), mergedText);

        List<DiffLine> diff = new ArrayList<>(lines.size());
        for (int i = 0; i < insertAt; i++) {
            diff.add(DiffLine.unchanged(i + 1, i + 1, original.get(i).content()));
        }
        for (int i = 0; i < block.size(); i++) {
            diff.add(DiffLine.added(insertAt + i + 1, block.get(i)));
        }
        for (int i = insertAt; i < original.size(); i++) {
            diff.add(DiffLine.unchanged(i + 1, i + block.size() + 1, original.get(i).content()));
        }
        log.debug("Merged fragment {} into {} at line {} ({} line(s))", fragment.id(), document.path(), insertAt + 1, block.size());
        return new MergeResult(merged, new WorkflowDiff(diff, insertAt, block.size()));
    }

    private Step anchorStep(TemplateFragment fragment, Job job, Integer afterStep) {
        if (afterStep == null) {
            return job.steps().get(job.steps().size() - 1);
        }
        if (afterStep < 0 || afterStep >= job.steps().size()) {
            throw new FragmentMergeException(fragment.id(), "job '" + job.id() + "' has no step #" + (afterStep + 1));
        }
        return job.steps().get(afterStep);
    }

    private Node compose(TemplateFragment fragment) {
        Node root;
        try {
            root = new Yaml().compose(new StringReader(fragment.content() == null ? "" : fragment.content()));
        } catch (YAMLException e) {
            throw new FragmentMergeException(fragment.id(), "template is not valid YAML: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new FragmentMergeException(fragment.id(), "template is empty");
        }
        return root;
    }

    private PipelineDocument reparse(TemplateFragment fragment, String path, String text) {
        try {
            return pipelineParser.parse(path, text);
        } catch (PipelineParseException e) {
            throw new FragmentMergeException(fragment.id(), "merged workflow is invalid: " + e.getMessage(), e);
        }
    }

    private static boolean isWrappedJob(MappingNode mapping) {
        if (mapping.getValue().size() != 1) {
            return false;
        }
        NodeTuple entry = mapping.getValue().get(0);
        return entry.getKeyNode() instanceof ScalarNode key
                && entry.getValueNode() instanceof MappingNode
                && !JOB_KEYS.contains(key.getValue());
    }

    private static String generatedJobId(TemplateFragment fragment) {
        if (fragment.category() == null || fragment.category().isBlank()) {
            return GENERATED_JOB_PREFIX;
        }
        return GENERATED_JOB_PREFIX + "-" + fragment.category().trim().replaceAll("[^A-Za-z0-9_-]+", "-");
    }

    private static String uniqueJobId(PipelineDocument document, String jobId) {
        String candidate = jobId;
        int suffix = 2;
        while (document.findJob(candidate).isPresent()) {
            candidate = jobId + "-" + suffix++;
        }
        return candidate;
    }

    /**
     * Rewrites the job key of a wrapped job fragment, already re-indented to {@code jobIndent}.
     */
    private static void renameJobKey(FragmentText text, Node keyNode, List<String> lines, int jobIndent, String jobId) {
        int lineIndex = keyNode.getStartMark().getLine() - text.offset();
        String source = text.lines().get(lineIndex);
        String rawKey = source.substring(keyNode.getStartMark().getColumn(), keyNode.getEndMark().getColumn());
        int keyColumn = jobIndent + keyNode.getStartMark().getColumn() - text.baseIndent();
        String line = lines.get(lineIndex);
        lines.set(lineIndex, line.substring(0, keyColumn) + jobId + line.substring(keyColumn + rawKey.length()));
    }

    /**
     * A single step mapping: the first line gets the {@code - } marker, the others line up under it.
     */
    private static List<String> asSequenceItem(FragmentText text, int indent) {
        List<String> lines = new ArrayList<>();
        boolean first = true;
        for (String line : text.lines()) {
            if (TextLines.isBlank(line)) {
                lines.add("");
                continue;
            }
            String stripped = line.substring(Math.min(text.baseIndent(), TextLines.leadingSpaces(line)));
            if (first && !TextLines.isComment(line)) {
                lines.add(" ".repeat(indent) + "- " + stripped);
                first = false;
            } else {
                lines.add(" ".repeat(indent + 2) + stripped);
            }
        }
        return lines;
    }

    private static List<String> reindent(List<String> lines, int baseIndent, int indent) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (TextLines.isBlank(line)) {
                result.add("");
            } else {
                result.add(" ".repeat(indent) + line.substring(Math.min(baseIndent, TextLines.leadingSpaces(line))));
            }
        }
        return result;
    }

    /**
     * Fragment lines without the blank lines around them.
     *
     * @param offset     number of leading lines dropped, to map YAML marks onto {@code lines}
     * @param baseIndent smallest indentation of a content line
     */
    private record FragmentText(List<String> lines, int offset, int baseIndent) {

        static FragmentText of(String content) {
            List<String> all = TextLines.split(content).stream().map(SourceLine::content).toList();
            int start = 0;
            int end = all.size();
            while (start < end && TextLines.isBlank(all.get(start))) {
                start++;
            }
            while (end > start && TextLines.isBlank(all.get(end - 1))) {
                end--;
            }
            List<String> lines = all.subList(start, end);
            int baseIndent = lines.stream()
                    .filter(line -> !TextLines.isBlank(line) && !TextLines.isComment(line))
                    .mapToInt(TextLines::leadingSpaces)
                    .min()
                    .orElse(0);
            return new FragmentText(lines, start, baseIndent);
        }
    }
}
