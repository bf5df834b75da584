package fr.imt.scanzilla.scanzilla.configuration;

import feign.RequestInterceptor;
import org.springframework.context.annotation.Bean;

/**
 * Feign configuration of the GitHub client only, so it is not a {@code @Configuration}.
 */
public class GitHubClientConfiguration {

    @Bean
    public RequestInterceptor gitHubHeadersInterceptor(ScanzillaProperties properties) {
        return template -> {
            template.header("Accept", "application/vnd.github+json");
            template.header("X-GitHub-Api-Version", "2022-11-28");
            String token = properties.getGithub().getToken();
            if (token != null && !token.isBlank()) {
                template.header("Authorization", "Bearer " + token);
            }
        };
    }
}
