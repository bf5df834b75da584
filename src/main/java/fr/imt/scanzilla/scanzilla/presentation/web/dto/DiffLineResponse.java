package fr.imt.scanzilla.scanzilla.presentation.web.dto;

import lombok.Data;

@Data
public class DiffLineResponse {
    private String type;
    private Integer originalLineNumber;
    private Integer mergedLineNumber;
    private String text;
}
