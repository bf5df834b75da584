package fr.imt.scanzilla.scanzilla.infrastructure.github;

import fr.imt.scanzilla.scanzilla.configuration.GitHubClientConfiguration;
import fr.imt.scanzilla.scanzilla.infrastructure.github.dto.GitHubContent;
import fr.imt.scanzilla.scanzilla.infrastructure.github.dto.GitHubRepositoryInfo;
import fr.imt.scanzilla.scanzilla.infrastructure.github.dto.GitHubTree;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@FeignClient(name = "github", url = "${scanzilla.github.api-url:https://api.github.com}",
        configuration = GitHubClientConfiguration.class)
public interface GitHubClient {

    @GetMapping("/repos/{owner}/{repo}")
    GitHubRepositoryInfo getRepository(
            @PathVariable("owner") String owner,
            @PathVariable("repo") String repo
    );

    @GetMapping("/repos/{owner}/{repo}/git/trees/{ref}?recursive=1")
    GitHubTree getTree(
            @PathVariable("owner") String owner,
            @PathVariable("repo") String repo,
            @PathVariable("ref") String ref
    );

    @GetMapping("/repos/{owner}/{repo}/contents/{path}")
    List<GitHubContent> listDirectory(
            @PathVariable("owner") String owner,
            @PathVariable("repo") String repo,
            @PathVariable("path") String path,
            @RequestParam("ref") String ref
    );

    @GetMapping("/repos/{owner}/{repo}/contents/{path}")
    GitHubContent getFile(
            @PathVariable("owner") String owner,
            @PathVariable("repo") String repo,
            @PathVariable("path") String path,
            @RequestParam("ref") String ref
    );

}
