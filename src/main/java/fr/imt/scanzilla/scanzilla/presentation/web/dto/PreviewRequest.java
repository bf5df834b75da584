package fr.imt.scanzilla.scanzilla.presentation.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PreviewRequest {

    @NotBlank
    private String repository;

    @NotBlank
    private String fragmentId;
}
