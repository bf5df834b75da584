package fr.imt.scanzilla.scanzilla.infrastructure.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "templates")
public class TemplateFragmentDocument {

    @Id
    private String id;

    private String name;

    private String description;

    private String content;

    /**
     * {@code workflow}, {@code job} or {@code step}
     */
    private String templateType;

    private String category;

    @Builder.Default
    private List<String> scanningCategories = new ArrayList<>();

    @Builder.Default
    private List<String> compatibleLanguages = new ArrayList<>();

    @Builder.Default
    private List<String> requiredSecrets = new ArrayList<>();

    @Builder.Default
    private List<String> requiredVariables = new ArrayList<>();

    @Builder.Default
    private int priority = 100;

}
