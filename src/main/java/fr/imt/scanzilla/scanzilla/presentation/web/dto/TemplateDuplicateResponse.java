package fr.imt.scanzilla.scanzilla.presentation.web.dto;

import lombok.Data;

import java.util.List;

@Data
public class TemplateDuplicateResponse {
    private String workflowPath;
    private String scope;
    private String jobId;
    private List<Integer> stepIndices;
    private String fragmentId;
    private String fragmentName;
    private String description;
}
