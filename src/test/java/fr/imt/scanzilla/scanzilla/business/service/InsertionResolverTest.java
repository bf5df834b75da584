package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.AssessmentDecision;
import fr.imt.scanzilla.scanzilla.business.model.InsertionPoint;
import fr.imt.scanzilla.scanzilla.business.model.InsertionTier;
import fr.imt.scanzilla.scanzilla.business.model.PipelineDocument;
import fr.imt.scanzilla.scanzilla.business.model.ResolvedTarget;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InsertionResolverTest {

    private static final String NEW_FILE = ".github/workflows/security-scan.yml";

    private static final String LINT_AND_DOCS = """
            on: push
            jobs:
              lint:
                steps:
                  - run: echo lint
              docs:
                steps:
                  - run: echo docs
            """;

    private static final String SCANNED_BUILD = """
            on: push
            jobs:
              build:
                steps:
                  - run: mvn -B verify
                  - uses: blackduck-inc/black-duck-security-scan@v2.0.0
            """;

    private final PipelineParser parser = new PipelineParser();
    private final InsertionResolver resolver = new InsertionResolver();

    @Test
    void resolve_BuildJob_AppendsStepAfterLastBuildStep() {
        PipelineDocument document = parser.parse("ci.yml", PipelineParserTest.MAVEN_CI);

        InsertionPoint point = resolver.resolve(document, AssessmentDecision.SAST_SCA);

        assertThat(point.tier()).isEqualTo(InsertionTier.APPEND_STEP);
        assertThat(point.targetJob()).isEqualTo("build");
        assertThat(point.afterStep()).isEqualTo(2);
        assertThat(point.reasoning()).contains("'Build'");
        assertThat(point.describe()).isEqualTo("Add a step to job 'build' after step #3");
    }

    @Test
    void resolve_NoBuildStep_AppendsJobAfterLastJob() {
        PipelineDocument document = parser.parse("ci.yml", LINT_AND_DOCS);

        InsertionPoint point = resolver.resolve(document, AssessmentDecision.SAST);

        assertThat(point.tier()).isEqualTo(InsertionTier.APPEND_JOB);
        assertThat(point.afterJob()).isEqualTo("docs");
        assertThat(point.targetJob()).isNull();
    }

    @Test
    void resolve_NoJobs_NewPipelineFile() {
        InsertionPoint point = resolver.resolve(parser.parse("empty.yml", "name: nothing\n"), AssessmentDecision.SAST);

        assertThat(point.tier()).isEqualTo(InsertionTier.NEW_PIPELINE_FILE);
    }

    @Test
    void resolve_ScannedJobsAreSkipped() {
        String workflow = SCANNED_BUILD + """
                  package:
                    steps:
                      - run: npm ci
                """;

        InsertionPoint point = resolver.resolve(parser.parse("ci.yml", workflow), AssessmentDecision.SAST);

        assertThat(point.tier()).isEqualTo(InsertionTier.APPEND_STEP);
        assertThat(point.targetJob()).isEqualTo("package");
        assertThat(point.afterStep()).isZero();
    }

    @Test
    void resolve_EveryJobScanned_AlreadyCovered() {
        InsertionPoint point = resolver.resolve(parser.parse("ci.yml", SCANNED_BUILD), AssessmentDecision.SAST_SCA);

        assertThat(point.tier()).isEqualTo(InsertionTier.ALREADY_COVERED);
        assertThat(point.tier().acceptedKind()).isEmpty();
    }

    @Test
    void resolve_Repository_PrefersStepOverJobWhateverTheOrder() {
        PipelineDocument docs = parser.parse(".github/workflows/docs.yml", LINT_AND_DOCS);
        PipelineDocument ci = parser.parse(".github/workflows/ci.yml", PipelineParserTest.MAVEN_CI);

        ResolvedTarget target = resolver.resolve(List.of(docs, ci), AssessmentDecision.SAST, NEW_FILE);

        assertThat(target.targetPath()).isEqualTo(".github/workflows/ci.yml");
        assertThat(target.point().tier()).isEqualTo(InsertionTier.APPEND_STEP);
    }

    @Test
    void resolve_Repository_JobBeforeAlreadyCovered() {
        PipelineDocument scanned = parser.parse(".github/workflows/scan.yml", SCANNED_BUILD);
        PipelineDocument docs = parser.parse(".github/workflows/docs.yml", LINT_AND_DOCS);

        ResolvedTarget target = resolver.resolve(List.of(scanned, docs), AssessmentDecision.SAST, NEW_FILE);

        assertThat(target.targetPath()).isEqualTo(".github/workflows/docs.yml");
        assertThat(target.point().tier()).isEqualTo(InsertionTier.APPEND_JOB);
    }

    @Test
    void resolve_Repository_OnlyCoveredWorkflows() {
        PipelineDocument scanned = parser.parse(".github/workflows/scan.yml", SCANNED_BUILD);

        ResolvedTarget target = resolver.resolve(List.of(scanned), AssessmentDecision.SAST, NEW_FILE);

        assertThat(target.point().tier()).isEqualTo(InsertionTier.ALREADY_COVERED);
    }

    @Test
    void resolve_Repository_WithoutWorkflows_CreatesNewFile() {
        ResolvedTarget target = resolver.resolve(List.of(), AssessmentDecision.SAST, NEW_FILE);

        assertThat(target.point().tier()).isEqualTo(InsertionTier.NEW_PIPELINE_FILE);
        assertThat(target.targetPath()).isEqualTo(NEW_FILE);
        assertThat(target.document().hasJobs()).isFalse();
        assertThat(target.document().lines()).isEmpty();
    }
}
