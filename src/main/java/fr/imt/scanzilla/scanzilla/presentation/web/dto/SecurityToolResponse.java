package fr.imt.scanzilla.scanzilla.presentation.web.dto;

import lombok.Data;

@Data
public class SecurityToolResponse {
    private String workflowPath;
    private String jobId;
    private String stepName;
    private String tool;
}
