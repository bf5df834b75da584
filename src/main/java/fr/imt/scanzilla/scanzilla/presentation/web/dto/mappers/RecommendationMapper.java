package fr.imt.scanzilla.scanzilla.presentation.web.dto.mappers;

import fr.imt.scanzilla.scanzilla.business.model.Recommendation;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.RecommendationResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface RecommendationMapper {

    @Mapping(target = "insertionTier", source = "insertionPoint.tier")
    @Mapping(target = "targetJob", source = "insertionPoint.targetJob")
    @Mapping(target = "afterJob", source = "insertionPoint.afterJob")
    @Mapping(target = "afterStep", source = "insertionPoint.afterStep")
    @Mapping(target = "insertionDescription", expression = "java(recommendation.insertionPoint().describe())")
    @Mapping(target = "assessmentDecision", source = "decision")
    RecommendationResponse toResponse(Recommendation recommendation);
}
