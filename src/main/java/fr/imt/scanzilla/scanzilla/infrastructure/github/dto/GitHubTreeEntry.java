package fr.imt.scanzilla.scanzilla.infrastructure.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubTreeEntry {

    public static final String BLOB = "blob";

    private String path;

    /**
     * {@code blob}, {@code tree} or {@code commit}
     */
    private String type;
}
