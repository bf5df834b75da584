package fr.imt.scanzilla.scanzilla.presentation.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {

    /**
     * Repositories as {@code owner/name}.
     */
    @NotEmpty
    private List<@NotBlank String> repositories;
}
