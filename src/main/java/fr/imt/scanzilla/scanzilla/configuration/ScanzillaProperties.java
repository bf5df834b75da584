package fr.imt.scanzilla.scanzilla.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "scanzilla")
public class ScanzillaProperties {

    private Analysis analysis = new Analysis();

    private GitHub github = new GitHub();

    @Data
    public static class Analysis {

        /**
         * Maximum number of repositories analyzed at the same time.
         */
        private int batchWidth = 10;

        /**
         * Path of the workflow file created when a repository has no usable workflow.
         */
        private String newPipelineFile = ".github/workflows/security-scan.yml";
    }

    @Data
    public static class GitHub {

        private String apiUrl = "https://api.github.com";

        private String token;

        private String workflowsPath = ".github/workflows";
    }
}
