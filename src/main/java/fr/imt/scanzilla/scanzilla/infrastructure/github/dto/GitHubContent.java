package fr.imt.scanzilla.scanzilla.infrastructure.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An entry of the contents API: a directory listing item, or a file with its base64 content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubContent {

    public static final String FILE = "file";

    private String name;

    private String path;

    private String type;

    private String content;

    private String encoding;
}
