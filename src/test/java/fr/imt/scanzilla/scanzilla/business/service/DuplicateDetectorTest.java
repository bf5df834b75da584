package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.AssessmentDecision;
import fr.imt.scanzilla.scanzilla.business.model.DuplicateScope;
import fr.imt.scanzilla.scanzilla.business.model.FragmentKind;
import fr.imt.scanzilla.scanzilla.business.model.TemplateDuplicate;
import fr.imt.scanzilla.scanzilla.business.model.TemplateFragment;
import fr.imt.scanzilla.scanzilla.business.model.WorkflowFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static fr.imt.scanzilla.scanzilla.business.service.FragmentFixtures.CATALOG;
import static fr.imt.scanzilla.scanzilla.business.service.FragmentFixtures.CHECKOUT_AND_BUILD;
import static fr.imt.scanzilla.scanzilla.business.service.FragmentFixtures.POLARIS_JOB;
import static org.assertj.core.api.Assertions.assertThat;

class DuplicateDetectorTest {

    private static final String CI_PATH = ".github/workflows/ci.yml";

    private final DuplicateDetector detector = new DuplicateDetector(new FragmentRenderer());

    @Test
    void detect_JobCopiedFromRenderedTemplate_IsReported() {
        String workflow = """
                on: push
                jobs:
                  build:
                    runs-on: ubuntu-latest
                    steps:
                      - run: mvn -B package
                  # formatting and key order do not matter
                  polaris:
                    steps:
                      - uses: actions/checkout@v4
                      - with: {polaris_assessment_types: 'SAST,SCA'}
                        name: Polaris Security Scan
                        uses: blackduck-inc/black-duck-security-scan@v2.0.0
                    runs-on: ubuntu-latest
                """;

        List<TemplateDuplicate> duplicates = detector.detect(
                List.of(new WorkflowFile(CI_PATH, workflow)), List.of(POLARIS_JOB), AssessmentDecision.SAST_SCA);

        assertThat(duplicates).singleElement().satisfies(duplicate -> {
            assertThat(duplicate.scope()).isEqualTo(DuplicateScope.JOB);
            assertThat(duplicate.jobId()).isEqualTo("polaris");
            assertThat(duplicate.fragmentId()).isEqualTo("polaris-job");
            assertThat(duplicate.describe())
                    .isEqualTo("Job 'polaris' of .github/workflows/ci.yml is an exact copy of template 'Polaris job'");
        });
    }

    @Test
    void detect_RenderedForAnotherDecision_IsNotADuplicate() {
        String workflow = """
                on: push
                jobs:
                  polaris:
                    runs-on: ubuntu-latest
                    steps:
                      - uses: actions/checkout@v4
                      - name: Polaris Security Scan
                        uses: blackduck-inc/black-duck-security-scan@v2.0.0
                        with:
                          polaris_assessment_types: "SAST"
                """;

        assertThat(detector.detect(List.of(new WorkflowFile(CI_PATH, workflow)), List.of(POLARIS_JOB),
                AssessmentDecision.SAST_SCA)).isEmpty();
    }

    @Test
    void detect_StepListTemplate_MatchesConsecutiveSteps() {
        TemplateFragment setupAndScan = TemplateFragment.builder()
                .id("setup-and-scan")
                .name("Setup and scan")
                .kind(FragmentKind.STEP)
                .category("coverity")
                .content("""
                        - uses: actions/setup-java@v4
                          with:
                            java-version: '17'
                        - run: coverity scan
                        """)
                .build();
        String workflow = """
                on: push
                jobs:
                  build:
                    steps:
                      - uses: actions/checkout@v4
                      - uses: actions/setup-java@v4
                        with:
                          java-version: '17'
                      - run: coverity scan
                      - run: mvn -B package
                """;

        List<TemplateDuplicate> duplicates = detector.detect(
                List.of(new WorkflowFile(CI_PATH, workflow)), List.of(setupAndScan), AssessmentDecision.SAST);

        assertThat(duplicates).singleElement().satisfies(duplicate -> {
            assertThat(duplicate.scope()).isEqualTo(DuplicateScope.STEPS);
            assertThat(duplicate.jobId()).isEqualTo("build");
            assertThat(duplicate.stepIndices()).containsExactly(1, 2);
            assertThat(duplicate.describe()).startsWith("Step(s) #2-#3 of job 'build'");
        });
    }

    @Test
    void detect_WorkflowWithoutCopies_ReportsNothing() {
        assertThat(detector.detect(List.of(new WorkflowFile(CI_PATH, CHECKOUT_AND_BUILD)), CATALOG,
                AssessmentDecision.SAST_SCA)).isEmpty();
    }

    @Test
    void detect_UnreadableWorkflowOrTemplate_IsSkipped() {
        TemplateFragment broken = POLARIS_JOB.toBuilder().id("broken").content("runs-on: [oops\n").build();

        List<TemplateDuplicate> duplicates = detector.detect(
                List.of(new WorkflowFile(CI_PATH, "jobs: [oops\n"), new WorkflowFile("other.yml", CHECKOUT_AND_BUILD)),
                List.of(broken), AssessmentDecision.SAST);

        assertThat(duplicates).isEmpty();
    }
}
