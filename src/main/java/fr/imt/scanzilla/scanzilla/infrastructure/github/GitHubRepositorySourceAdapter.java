package fr.imt.scanzilla.scanzilla.infrastructure.github;

import feign.FeignException;
import fr.imt.scanzilla.scanzilla.business.model.RepositorySources;
import fr.imt.scanzilla.scanzilla.business.model.WorkflowFile;
import fr.imt.scanzilla.scanzilla.business.port.RepositorySourcePort;
import fr.imt.scanzilla.scanzilla.configuration.ScanzillaProperties;
import fr.imt.scanzilla.scanzilla.exception.RepositoryFetchException;
import fr.imt.scanzilla.scanzilla.infrastructure.github.dto.GitHubContent;
import fr.imt.scanzilla.scanzilla.infrastructure.github.dto.GitHubRepositoryInfo;
import fr.imt.scanzilla.scanzilla.infrastructure.github.dto.GitHubTree;
import fr.imt.scanzilla.scanzilla.infrastructure.github.dto.GitHubTreeEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reads what the analysis needs from a GitHub repository, on its default branch.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GitHubRepositorySourceAdapter implements RepositorySourcePort {

    private static final String FALLBACK_BRANCH = "main";

    private final GitHubClient gitHubClient;
    private final RetryTemplate githubRetryTemplate;
    private final ScanzillaProperties properties;

    @Override
    public RepositorySources fetch(String repository) {
        String[] coordinates = coordinates(repository);
        String owner = coordinates[0];
        String name = coordinates[1];
        try {
            GitHubRepositoryInfo info = withRetry(() -> gitHubClient.getRepository(owner, name));
            String branch = info != null && info.getDefaultBranch() != null ? info.getDefaultBranch() : FALLBACK_BRANCH;

            List<String> filePaths = listFiles(repository, owner, name, branch);
            List<WorkflowFile> workflows = readWorkflows(owner, name, branch);
            log.info("Fetched {} on {}: {} file(s), {} workflow(s)", repository, branch, filePaths.size(), workflows.size());
            return new RepositorySources(repository, workflows, filePaths);
        } catch (FeignException.NotFound e) {
            throw new RepositoryFetchException(repository, "repository not found or not accessible", e);
        } catch (FeignException e) {
            String reason = e.status() < 0 ? "GitHub API unreachable" : "GitHub API returned status " + e.status();
            throw new RepositoryFetchException(repository, reason, e);
        }
    }

    private List<String> listFiles(String repository, String owner, String name, String branch) {
        GitHubTree tree = withRetry(() -> gitHubClient.getTree(owner, name, branch));
        if (tree == null || tree.getTree() == null) {
            return List.of();
        }
        if (tree.isTruncated()) {
            log.warn("File tree of {} is truncated by GitHub; manifest detection may be incomplete", repository);
        }
        return tree.getTree().stream()
                .filter(entry -> GitHubTreeEntry.BLOB.equals(entry.getType()))
                .map(GitHubTreeEntry::getPath)
                .toList();
    }

    private List<WorkflowFile> readWorkflows(String owner, String name, String branch) {
        String workflowsPath = properties.getGithub().getWorkflowsPath();
        List<GitHubContent> entries;
        try {
            entries = withRetry(() -> gitHubClient.listDirectory(owner, name, workflowsPath, branch));
        } catch (FeignException.NotFound e) {
            log.debug("{}/{} has no {} directory", owner, name, workflowsPath);
            return List.of();
        }
        if (entries == null) {
            return List.of();
        }

        List<WorkflowFile> workflows = new ArrayList<>();
        for (GitHubContent entry : entries) {
            if (!GitHubContent.FILE.equals(entry.getType()) || !isWorkflowFile(entry.getName())) {
                continue;
            }
            GitHubContent file = withRetry(() -> gitHubClient.getFile(owner, name, entry.getPath(), branch));
            workflows.add(new WorkflowFile(entry.getPath(), decode(file)));
        }
        return workflows;
    }

    private <T> T withRetry(Supplier<T> call) {
        return githubRetryTemplate.execute(context -> call.get());
    }

    private static boolean isWorkflowFile(String fileName) {
        return fileName != null && (fileName.endsWith(".yml") || fileName.endsWith(".yaml"));
    }

    private static String decode(GitHubContent file) {
        if (file == null || file.getContent() == null) {
            return "";
        }
        byte[] bytes = Base64.getMimeDecoder().decode(file.getContent());
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static String[] coordinates(String repository) {
        String[] parts = repository == null ? new String[0] : repository.trim().split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new RepositoryFetchException(String.valueOf(repository), "expected a repository as owner/name");
        }
        return parts;
    }
}
