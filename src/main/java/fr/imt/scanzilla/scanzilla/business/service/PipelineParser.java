package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.Job;
import fr.imt.scanzilla.scanzilla.business.model.LineSpan;
import fr.imt.scanzilla.scanzilla.business.model.PipelineDocument;
import fr.imt.scanzilla.scanzilla.business.model.SourceLine;
import fr.imt.scanzilla.scanzilla.business.model.Step;
import fr.imt.scanzilla.scanzilla.business.model.Trigger;
import fr.imt.scanzilla.scanzilla.business.utils.StepIndicators;
import fr.imt.scanzilla.scanzilla.business.utils.TextLines;
import fr.imt.scanzilla.scanzilla.exception.PipelineParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns the raw text of a workflow file into a {@link PipelineDocument}.
 * <p>
 * Structure comes from the SnakeYAML node graph, whose marks give the line where each job
 * and step starts. Where it ends is found on the line list: the last content line before the
 * next line indented at or left of the item's own indentation.
 */
@Service
@Slf4j
public class PipelineParser {

    private static final String UNNAMED_STEP = "Unnamed step";

    public PipelineDocument parse(String path, String rawText) {
        List<SourceLine> lines = TextLines.split(rawText);
        Node root = compose(path, rawText);
        if (root == null) {
            return new PipelineDocument(path, lines, null, Trigger.none(), List.of(), -1, false);
        }
        if (!(root instanceof MappingNode workflow)) {
            throw parseError(path, root, "a workflow must be a mapping");
        }

        String name = scalar(valueOf(workflow, "name").orElse(null));
        Trigger trigger = valueOf(workflow, "on").map(PipelineParser::trigger).orElse(Trigger.none());

        Optional<Node> jobsNode = valueOf(workflow, "jobs");
        if (jobsNode.isEmpty() || isNull(jobsNode.get())) {
            return new PipelineDocument(path, lines, name, trigger, List.of(), -1, false);
        }
        if (!(jobsNode.get() instanceof MappingNode jobsMapping)) {
            throw parseError(path, jobsNode.get(), "'jobs' must be a mapping");
        }

        boolean flowJobs = jobsMapping.getFlowStyle() == DumperOptions.FlowStyle.FLOW;
        List<Job> jobs = new ArrayList<>();
        int jobIndent = -1;
        for (NodeTuple tuple : jobsMapping.getValue()) {
            String jobId = scalar(tuple.getKeyNode());
            if (!(tuple.getValueNode() instanceof MappingNode jobNode)) {
                log.debug("Skipping job '{}' of {}: not a mapping", jobId, path);
                continue;
            }
            Mark keyMark = tuple.getKeyNode().getStartMark();
            if (jobIndent < 0) {
                jobIndent = keyMark.getColumn();
            }
            jobs.add(job(path, lines, jobId, keyMark, jobNode, flowJobs));
        }
        log.debug("Parsed {}: {} job(s), triggers {}", path, jobs.size(), trigger.events());
        return new PipelineDocument(path, lines, name, trigger, jobs, jobIndent, flowJobs);
    }

    private Node compose(String path, String rawText) {
        try {
            return new Yaml().compose(new StringReader(rawText == null ? "" : rawText));
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark() != null ? e.getProblemMark() : e.getContextMark();
            int line = mark != null ? mark.getLine() + 1 : 0;
            int column = mark != null ? mark.getColumn() + 1 : 0;
            String problem = e.getProblem() != null ? e.getProblem() : e.getMessage();
            throw new PipelineParseException(path, line, column, problem, e);
        } catch (YAMLException e) {
            throw new PipelineParseException(path, 0, 0, e.getMessage(), e);
        }
    }

    private Job job(String path, List<SourceLine> lines, String jobId, Mark keyMark, MappingNode jobNode, boolean flowJobs) {
        String displayName = Optional.ofNullable(scalar(valueOf(jobNode, "name").orElse(null))).orElse(jobId);
        checkLine(path, lines, keyMark, false);
        checkLine(path, lines, jobNode.getEndMark(), true);
        LineSpan span = flowJobs
                ? new LineSpan(keyMark.getLine(), jobNode.getEndMark().getLine())
                : contentSpan(lines, keyMark.getLine(), keyMark.getColumn());

        List<Step> steps = new ArrayList<>();
        int stepIndent = -1;
        boolean flowSteps = false;
        Optional<Node> stepsNode = valueOf(jobNode, "steps");
        if (stepsNode.isPresent() && stepsNode.get() instanceof SequenceNode stepSequence) {
            flowSteps = flowJobs || stepSequence.getFlowStyle() == DumperOptions.FlowStyle.FLOW;
            for (Node item : stepSequence.getValue()) {
                if (!(item instanceof MappingNode stepNode)) {
                    log.debug("Skipping non-mapping step in job '{}'", jobId);
                    continue;
                }
                checkLine(path, lines, item.getStartMark(), false);
                checkLine(path, lines, item.getEndMark(), true);
                ItemStart start = itemStart(lines, item.getStartMark());
                if (stepIndent < 0) {
                    stepIndent = start.dashColumn();
                }
                LineSpan stepSpan = flowSteps
                        ? new LineSpan(start.line(), item.getEndMark().getLine())
                        : contentSpan(lines, start.line(), start.dashColumn());
                steps.add(step(steps.size(), stepNode, stepSpan));
            }
        }
        return new Job(jobId, displayName, span, steps, stepIndent, flowSteps);
    }

    private Step step(int index, MappingNode stepNode, LineSpan span) {
        String uses = scalar(valueOf(stepNode, "uses").orElse(null));
        String run = scalar(valueOf(stepNode, "run").orElse(null));
        String name = scalar(valueOf(stepNode, "name").orElse(null));

        Optional<String> buildTool = StepIndicators.buildTool(run);
        Optional<String> language = StepIndicators.setupLanguage(uses);
        Optional<String> securityTool = securityTool(stepNode, name, run, uses);

        return Step.builder()
                .index(index)
                .id(scalar(valueOf(stepNode, "id").orElse(null)))
                .name(name != null ? name : uses != null ? uses : UNNAMED_STEP)
                .uses(uses)
                .run(run)
                .span(span)
                .buildStep(buildTool.isPresent() || language.isPresent())
                .testStep(StepIndicators.isTestCommand(run))
                .scanStep(securityTool.isPresent())
                .buildTool(buildTool.orElse(null))
                .language(language.orElse(null))
                .securityTool(securityTool.orElse(null))
                .build();
    }

    /**
     * From {@code startLine}, the last line that belongs to the item: every following line is
     * part of it until a non-comment line indented at or left of {@code boundaryIndent}.
     * Trailing blank lines and trailing comments at the boundary indentation are left out.
     */
    static LineSpan contentSpan(List<SourceLine> lines, int startLine, int boundaryIndent) {
        int lastContent = startLine;
        for (int i = startLine + 1; i < lines.size(); i++) {
            String content = lines.get(i).content();
            if (TextLines.isBlank(content)) {
                continue;
            }
            int indent = TextLines.leadingSpaces(content);
            if (indent <= boundaryIndent) {
                if (TextLines.isComment(content)) {
                    continue;
                }
                break;
            }
            lastContent = i;
        }
        return new LineSpan(startLine, lastContent);
    }

    /**
     * Inputs of the shared scan action name the tool more reliably than the action itself, then
     * come the step name, its command and its action.
     */
    private static Optional<String> securityTool(MappingNode stepNode, String name, String run, String uses) {
        List<String> inputs = valueOf(stepNode, "with")
                .filter(MappingNode.class::isInstance)
                .map(with -> ((MappingNode) with).getValue().stream()
                        .map(tuple -> scalar(tuple.getKeyNode()))
                        .filter(Objects::nonNull)
                        .toList())
                .orElse(List.of());
        return StepIndicators.securityToolFromInputs(inputs)
                .or(() -> StepIndicators.securityTool(name))
                .or(() -> StepIndicators.securityTool(run))
                .or(() -> StepIndicators.securityTool(uses));
    }

    /**
     * Line and column of the {@code -} that opens a sequence item whose mapping starts at {@code mark}.
     * The dash is either on the same line before the mapping, or alone on the line above it.
     */
    private static ItemStart itemStart(List<SourceLine> lines, Mark mark) {
        int line = mark.getLine();
        String content = lines.get(line).content();
        int i = Math.min(mark.getColumn(), content.length()) - 1;
        while (i >= 0 && content.charAt(i) == ' ') {
            i--;
        }
        if (i >= 0 && content.charAt(i) == '-') {
            return new ItemStart(line, i);
        }
        if (i < 0) {
            for (int previous = line - 1; previous >= 0; previous--) {
                String candidate = lines.get(previous).content();
                if (TextLines.isBlank(candidate) || TextLines.isComment(candidate)) {
                    continue;
                }
                if (isLoneDash(candidate)) {
                    return new ItemStart(previous, TextLines.leadingSpaces(candidate));
                }
                break;
            }
        }
        return new ItemStart(line, TextLines.leadingSpaces(content));
    }

    private static boolean isLoneDash(String content) {
        String stripped = content.strip();
        return stripped.equals("-") || (stripped.startsWith("- ") && TextLines.isComment(stripped.substring(2)));
    }

    /**
     * Marks must point into the line list; an end mark may also sit at the very end of the text.
     */
    private static void checkLine(String path, List<SourceLine> lines, Mark mark, boolean endMark) {
        boolean atEnd = endMark && mark.getLine() == lines.size() && mark.getColumn() == 0;
        if (mark.getLine() >= lines.size() && !atEnd) {
            throw new PipelineParseException(path, mark.getLine() + 1, mark.getColumn() + 1,
                    "position is outside the " + lines.size() + " line(s) of the file");
        }
    }

    private static Trigger trigger(Node on) {
        List<String> events = new ArrayList<>();
        if (on instanceof ScalarNode scalarNode) {
            events.add(scalarNode.getValue());
        } else if (on instanceof SequenceNode sequence) {
            sequence.getValue().stream().map(PipelineParser::scalar).filter(Objects::nonNull).forEach(events::add);
        } else if (on instanceof MappingNode mapping) {
            mapping.getValue().stream().map(tuple -> scalar(tuple.getKeyNode())).filter(Objects::nonNull).forEach(events::add);
        }
        return new Trigger(events);
    }

    private static Optional<Node> valueOf(MappingNode mapping, String key) {
        return mapping.getValue().stream()
                .filter(tuple -> key.equals(scalar(tuple.getKeyNode())))
                .map(NodeTuple::getValueNode)
                .findFirst();
    }

    private static String scalar(Node node) {
        return node instanceof ScalarNode scalarNode ? scalarNode.getValue() : null;
    }

    private static boolean isNull(Node node) {
        return node instanceof ScalarNode && Tag.NULL.equals(node.getTag());
    }

    private record ItemStart(int line, int dashColumn) {
    }

    private static PipelineParseException parseError(String path, Node node, String problem) {
        Mark mark = node.getStartMark();
        return new PipelineParseException(path, mark.getLine() + 1, mark.getColumn() + 1, problem);
    }
}
