package fr.imt.scanzilla.scanzilla.presentation.web.dto.mappers;

import fr.imt.scanzilla.scanzilla.business.model.AnalysisBatch;
import fr.imt.scanzilla.scanzilla.business.model.RepositoryAnalysis;
import fr.imt.scanzilla.scanzilla.business.model.SecurityToolUsage;
import fr.imt.scanzilla.scanzilla.business.model.TemplateDuplicate;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.AnalysisBatchResponse;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.RepositoryAnalysisResponse;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.SecurityToolResponse;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.TemplateDuplicateResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring", uses = RecommendationMapper.class)
public interface AnalysisMapper {

    @Mapping(target = "totalRepositories", expression = "java(batch.getRepositories().size())")
    @Mapping(target = "completedRepositories", source = "completedCount")
    AnalysisBatchResponse toBatchResponse(AnalysisBatch batch);

    @Mapping(target = "assessmentDecision", source = "assessment.decision")
    @Mapping(target = "confidence", source = "assessment.confidence")
    @Mapping(target = "primaryLanguage", source = "assessment.primaryLanguage")
    @Mapping(target = "assessmentReasoning", source = "assessment.reasoning")
    @Mapping(target = "packageManagers",
            expression = "java(analysis.assessment() == null ? java.util.List.of() : analysis.assessment().ecosystems())")
    @Mapping(target = "coverageStatus", source = "coverage.status")
    @Mapping(target = "securityTools", source = "coverage.tools")
    @Mapping(target = "duplicates", source = "coverage.duplicates")
    @Mapping(target = "polarisConfigFiles", source = "coverage.polarisConfigFiles")
    @Mapping(target = "polarisInRoot",
            expression = "java(analysis.coverage() != null && analysis.coverage().hasPolarisInRoot())")
    RepositoryAnalysisResponse toAnalysisResponse(RepositoryAnalysis analysis);

    SecurityToolResponse toSecurityToolResponse(SecurityToolUsage usage);

    @Mapping(target = "description", expression = "java(duplicate.describe())")
    TemplateDuplicateResponse toDuplicateResponse(TemplateDuplicate duplicate);
}
