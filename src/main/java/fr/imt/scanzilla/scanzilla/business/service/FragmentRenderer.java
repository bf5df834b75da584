package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.AssessmentDecision;
import fr.imt.scanzilla.scanzilla.business.model.InsertionTier;
import fr.imt.scanzilla.scanzilla.business.model.TemplateFragment;
import fr.imt.scanzilla.scanzilla.business.model.Trigger;
import org.springframework.stereotype.Service;

/**
 * Fills the placeholders of a template fragment before it is merged.
 */
@Service
public class FragmentRenderer {

    public static final String ASSESSMENT_TYPES_PLACEHOLDER = "{assessment_types}";
    public static final String SAST_TYPE_PLACEHOLDER = "{polaris_test_sast_type}";

    /**
     * Runs the fast SAST_RAPID mode only for pull requests being opened or updated, full SAST otherwise.
     */
    public static final String PULL_REQUEST_SAST_TYPE =
            "${{ (github.event_name == 'pull_request' && contains(fromJSON('[\"opened\",\"synchronize\",\"reopened\"]'), "
                    + "github.event.action)) && 'SAST_RAPID' || '' }}";

    public static final String PULL_REQUEST_OPTIMISATION_REASON =
            "SAST_RAPID mode for pull requests (faster feedback) and full SAST for push events (comprehensive analysis).";

    private static final String NO_SAST_TYPE = "''";

    public TemplateFragment render(TemplateFragment fragment, AssessmentDecision decision, boolean pullRequestOptimisation) {
        String content = fragment.content()
                .replace(ASSESSMENT_TYPES_PLACEHOLDER, decision.getPolarisValue())
                .replace(SAST_TYPE_PLACEHOLDER, pullRequestOptimisation ? PULL_REQUEST_SAST_TYPE : NO_SAST_TYPE);
        return fragment.withContent(content);
    }

    /**
     * A new workflow file is written with pull request triggers, so it always qualifies.
     */
    public boolean shouldOptimisePullRequests(AssessmentDecision decision, InsertionTier tier, Trigger trigger) {
        if (!decision.includesStaticAnalysis()) {
            return false;
        }
        return tier == InsertionTier.NEW_PIPELINE_FILE || trigger.hasPullRequestTrigger();
    }
}
