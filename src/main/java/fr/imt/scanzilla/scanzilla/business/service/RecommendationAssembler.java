package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.AssessmentDecision;
import fr.imt.scanzilla.scanzilla.business.model.AssessmentResult;
import fr.imt.scanzilla.scanzilla.business.model.CoverageStatus;
import fr.imt.scanzilla.scanzilla.business.model.FragmentKind;
import fr.imt.scanzilla.scanzilla.business.model.InsertionTier;
import fr.imt.scanzilla.scanzilla.business.model.Job;
import fr.imt.scanzilla.scanzilla.business.model.MergeResult;
import fr.imt.scanzilla.scanzilla.business.model.PipelineDocument;
import fr.imt.scanzilla.scanzilla.business.model.Recommendation;
import fr.imt.scanzilla.scanzilla.business.model.RepositoryAnalysis;
import fr.imt.scanzilla.scanzilla.business.model.RepositorySources;
import fr.imt.scanzilla.scanzilla.business.model.ResolvedTarget;
import fr.imt.scanzilla.scanzilla.business.model.ScanCoverage;
import fr.imt.scanzilla.scanzilla.business.model.SecurityToolUsage;
import fr.imt.scanzilla.scanzilla.business.model.Step;
import fr.imt.scanzilla.scanzilla.business.model.TemplateFragment;
import fr.imt.scanzilla.scanzilla.business.model.WorkflowFile;
import fr.imt.scanzilla.scanzilla.business.utils.StepIndicators;
import fr.imt.scanzilla.scanzilla.configuration.ScanzillaProperties;
import fr.imt.scanzilla.scanzilla.exception.FragmentMergeException;
import fr.imt.scanzilla.scanzilla.exception.PipelineParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the whole analysis of one repository and ranks the fragments that can be applied to it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecommendationAssembler {

    static final String LOW_CONFIDENCE_CAVEAT =
            "No package manifest was found, so this recommendation relies on defaults and should be reviewed.";

    private static final Set<String> POLARIS_CONFIG_FILES = Set.of("polaris.yml", "polaris.yaml");

    private static final Comparator<Recommendation> RANKING = Comparator
            .comparing((Recommendation recommendation) -> !recommendation.languageMatch())
            .thenComparingInt(Recommendation::priority)
            .thenComparing(Recommendation::fragmentName, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Recommendation::fragmentId);

    private final PipelineParser pipelineParser;
    private final SignalDetector signalDetector;
    private final AssessmentPolicy assessmentPolicy;
    private final InsertionResolver insertionResolver;
    private final FragmentRenderer fragmentRenderer;
    private final FragmentMerger fragmentMerger;
    private final DuplicateDetector duplicateDetector;
    private final ScanzillaProperties properties;

    /**
     * Never throws for repository content: a workflow that cannot be parsed makes the
     * repository {@code FAILED} with the parse error as reason.
     */
    public RepositoryAnalysis assemble(RepositorySources sources, List<TemplateFragment> catalog) {
        List<PipelineDocument> documents = new ArrayList<>();
        for (WorkflowFile file : sources.workflowFiles()) {
            try {
                documents.add(pipelineParser.parse(file.path(), file.content()));
            } catch (PipelineParseException e) {
                log.warn("Repository {} excluded from analysis: {}", sources.repository(), e.getMessage());
                return RepositoryAnalysis.failed(sources.repository(), e.getMessage());
            }
        }

        Set<String> workflowLanguages = new LinkedHashSet<>();
        documents.forEach(document -> workflowLanguages.addAll(document.languages()));
        AssessmentResult assessment = assessmentPolicy.decide(signalDetector.detect(sources.filePaths()), workflowLanguages);
        AssessmentDecision decision = assessment.decision();
        ResolvedTarget target = insertionResolver.resolve(documents, decision, properties.getAnalysis().getNewPipelineFile());
        ScanCoverage coverage = coverage(sources, documents, catalog, decision);

        Optional<FragmentKind> kind = target.point().tier().acceptedKind();
        if (kind.isEmpty()) {
            log.info("Repository {}: {}", sources.repository(), target.point().reasoning());
            return RepositoryAnalysis.analyzed(sources.repository(), assessment, coverage, List.of());
        }

        Set<String> languages = new LinkedHashSet<>(assessment.languages());
        languages.addAll(workflowLanguages);
        Set<String> presentTools = new LinkedHashSet<>();
        documents.forEach(document -> presentTools.addAll(document.securityTools()));
        boolean pullRequestOptimisation = fragmentRenderer.shouldOptimisePullRequests(
                decision, target.point().tier(), target.document().trigger());

        Map<String, Recommendation> byFragment = new LinkedHashMap<>();
        for (TemplateFragment fragment : catalog) {
            if (byFragment.containsKey(fragment.id()) || !isCandidate(fragment, kind.get(), decision, languages, presentTools)) {
                continue;
            }
            TemplateFragment rendered = fragmentRenderer.render(fragment, decision, pullRequestOptimisation);
            try {
                fragmentMerger.merge(target.document(), rendered, target.point());
            } catch (FragmentMergeException e) {
                log.warn("Dropping fragment {} for repository {}: {}", fragment.id(), sources.repository(), e.getMessage());
                continue;
            }
            byFragment.put(fragment.id(), recommendation(fragment, target, assessment, languages, pullRequestOptimisation));
        }

        List<Recommendation> ranked = byFragment.values().stream().sorted(RANKING).toList();
        log.info("Repository {}: {} assessment, {}, {} recommendation(s) targeting {}",
                sources.repository(), decision, coverage.status(), ranked.size(), target.targetPath());
        return RepositoryAnalysis.analyzed(sources.repository(), assessment, coverage, ranked);
    }

    /**
     * Computes the enhanced workflow for a recommendation made on {@code sources}.
     */
    public MergeResult materialize(RepositorySources sources, Recommendation recommendation, TemplateFragment fragment) {
        PipelineDocument document;
        if (recommendation.insertionPoint().tier() == InsertionTier.NEW_PIPELINE_FILE) {
            document = PipelineDocument.empty(recommendation.targetPath());
        } else {
            WorkflowFile file = sources.workflowFiles().stream()
                    .filter(candidate -> candidate.path().equals(recommendation.targetPath()))
                    .findFirst()
                    .orElseThrow(() -> new FragmentMergeException(fragment.id(),
                            "workflow " + recommendation.targetPath() + " is no longer in the repository"));
            document = pipelineParser.parse(file.path(), file.content());
        }
        TemplateFragment rendered = fragmentRenderer.render(
                fragment, recommendation.decision(), recommendation.pullRequestOptimised());
        return fragmentMerger.merge(document, rendered, recommendation.insertionPoint());
    }

    private ScanCoverage coverage(RepositorySources sources, List<PipelineDocument> documents,
                                  List<TemplateFragment> catalog, AssessmentDecision decision) {
        List<SecurityToolUsage> tools = new ArrayList<>();
        for (PipelineDocument document : documents) {
            for (Job job : document.jobs()) {
                for (Step step : job.steps()) {
                    if (step.securityTool() != null) {
                        tools.add(new SecurityToolUsage(document.path(), job.id(), step.name(), step.securityTool()));
                    }
                }
            }
        }
        CoverageStatus status;
        if (!tools.isEmpty()) {
            status = CoverageStatus.CONFIGURED;
        } else if (!documents.isEmpty()) {
            status = CoverageStatus.NEEDS_ENHANCEMENT;
        } else {
            status = CoverageStatus.NEEDS_NEW_WORKFLOW;
        }
        List<String> polarisFiles = sources.filePaths().stream()
                .filter(POLARIS_CONFIG_FILES::contains)
                .toList();
        return new ScanCoverage(status, tools, duplicateDetector.detect(sources.workflowFiles(), catalog, decision),
                polarisFiles);
    }

    private static boolean isCandidate(TemplateFragment fragment, FragmentKind kind, AssessmentDecision decision,
                                       Set<String> languages, Set<String> presentTools) {
        if (fragment.kind() != kind || !fragment.covers(decision)) {
            return false;
        }
        if (!fragment.isLanguageAgnostic() && !languages.isEmpty() && !fragment.supportsAnyLanguage(languages)) {
            return false;
        }
        return StepIndicators.securityTool(fragment.category()).map(tool -> !presentTools.contains(tool)).orElse(true);
    }

    private static Recommendation recommendation(TemplateFragment fragment, ResolvedTarget target,
                                                 AssessmentResult assessment, Set<String> languages,
                                                 boolean pullRequestOptimisation) {
        boolean languageMatch = !fragment.isLanguageAgnostic() && fragment.supportsAnyLanguage(languages);
        boolean optimised = pullRequestOptimisation && fragment.content().contains(FragmentRenderer.SAST_TYPE_PLACEHOLDER);
        return Recommendation.builder()
                .fragmentId(fragment.id())
                .fragmentName(fragment.name())
                .fragmentKind(fragment.kind())
                .toolCategory(fragment.category())
                .targetPath(target.targetPath())
                .insertionPoint(target.point())
                .decision(assessment.decision())
                .rationale(rationale(fragment, target, assessment, languageMatch))
                .languageMatch(languageMatch)
                .priority(fragment.priority())
                .pullRequestOptimised(optimised)
                .pullRequestOptimisationReason(optimised ? FragmentRenderer.PULL_REQUEST_OPTIMISATION_REASON : null)
                .requiredSecrets(fragment.requiredSecrets())
                .requiredVariables(fragment.requiredVariables())
                .packageManagers(assessment.ecosystems())
                .lowConfidence(assessment.isLowConfidence())
                .build();
    }

    private static String rationale(TemplateFragment fragment, ResolvedTarget target, AssessmentResult assessment,
                                    boolean languageMatch) {
        String categories = fragment.scanCategories().stream()
                .filter(category -> assessment.decision().includes(category))
                .map(Enum::name)
                .sorted()
                .collect(Collectors.joining(", "));
        StringBuilder rationale = new StringBuilder()
                .append(fragment.name()).append(" provides ").append(categories).append(" scanning. ")
                .append(target.point().reasoning()).append(' ')
                .append(assessment.reasoning());
        if (languageMatch) {
            rationale.append(" Built for ").append(String.join(", ", fragment.languages())).append(" projects.");
        }
        if (assessment.isLowConfidence()) {
            rationale.append(' ').append(LOW_CONFIDENCE_CAVEAT);
        }
        return rationale.toString();
    }
}
