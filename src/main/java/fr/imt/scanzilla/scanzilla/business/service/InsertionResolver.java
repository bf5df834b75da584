package fr.imt.scanzilla.scanzilla.business.service;

import fr.imt.scanzilla.scanzilla.business.model.AssessmentDecision;
import fr.imt.scanzilla.scanzilla.business.model.InsertionPoint;
import fr.imt.scanzilla.scanzilla.business.model.InsertionTier;
import fr.imt.scanzilla.scanzilla.business.model.Job;
import fr.imt.scanzilla.scanzilla.business.model.PipelineDocument;
import fr.imt.scanzilla.scanzilla.business.model.ResolvedTarget;
import fr.imt.scanzilla.scanzilla.business.model.Step;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Chooses where a security scan goes in a workflow.
 * <p>
 * Jobs that already run a scan are never touched. Among the others, the first job with a
 * build step receives a new step right after its last build step; without one, a new job is
 * added after the last remaining job. A workflow without jobs gets a new pipeline file instead.
 */
@Service
@Slf4j
public class InsertionResolver {

    public InsertionPoint resolve(PipelineDocument document, AssessmentDecision decision) {
        if (!document.hasJobs()) {
            return InsertionPoint.newPipelineFile(
                    "Workflow " + document.path() + " defines no jobs; a dedicated security workflow will be created.");
        }

        List<Job> candidates = document.jobs().stream().filter(job -> !job.hasScanStep()).toList();
        if (candidates.isEmpty()) {
            return InsertionPoint.alreadyCovered(
                    "Every job of " + document.path() + " already runs a security scan.");
        }

        Optional<Job> buildJob = candidates.stream().filter(Job::hasBuildStep).findFirst();
        if (buildJob.isPresent()) {
            Job job = buildJob.get();
            Step anchor = job.lastBuildStep().or(job::lastStep).orElseThrow();
            log.debug("{} scan for {}: step after '{}' in job '{}'", decision, document.path(), anchor.name(), job.id());
            return InsertionPoint.appendStep(job.id(), anchor.index(),
                    "Job '" + job.id() + "' builds the project; the scan runs right after step '" + anchor.name() + "'.");
        }

        Job anchorJob = candidates.get(candidates.size() - 1);
        log.debug("{} scan for {}: new job after '{}'", decision, document.path(), anchorJob.id());
        return InsertionPoint.appendJob(anchorJob.id(),
                "No job of " + document.path() + " has a build step; the scan is added as a separate job.");
    }

    /**
     * Picks the workflow to enhance among all workflows of a repository.
     * A step in an existing build job is preferred over a new job, and both over a new file.
     * Ties go to the first document in the given order.
     */
    public ResolvedTarget resolve(List<PipelineDocument> documents, AssessmentDecision decision, String newPipelinePath) {
        ResolvedTarget firstJobTarget = null;
        ResolvedTarget coveredTarget = null;
        for (PipelineDocument document : documents) {
            InsertionPoint point = resolve(document, decision);
            if (point.tier() == InsertionTier.APPEND_STEP) {
                return new ResolvedTarget(document, point);
            }
            if (point.tier() == InsertionTier.APPEND_JOB && firstJobTarget == null) {
                firstJobTarget = new ResolvedTarget(document, point);
            }
            if (point.tier() == InsertionTier.ALREADY_COVERED && coveredTarget == null) {
                coveredTarget = new ResolvedTarget(document, point);
            }
        }
        if (firstJobTarget != null) {
            return firstJobTarget;
        }
        if (coveredTarget != null) {
            return coveredTarget;
        }
        String reasoning = documents.isEmpty()
                ? "Repository has no workflow files; a dedicated security workflow will be created."
                : "No workflow of the repository defines jobs; a dedicated security workflow will be created.";
        return new ResolvedTarget(PipelineDocument.empty(newPipelinePath), InsertionPoint.newPipelineFile(reasoning));
    }
}
