package fr.imt.scanzilla.scanzilla.infrastructure.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubTree {

    private String sha;

    private List<GitHubTreeEntry> tree = new ArrayList<>();

    private boolean truncated;
}
