package fr.imt.scanzilla.scanzilla.presentation.web.dto.mappers;

import fr.imt.scanzilla.scanzilla.business.model.DiffLine;
import fr.imt.scanzilla.scanzilla.business.model.EnhancementPreview;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.DiffLineResponse;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.PreviewResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring", uses = RecommendationMapper.class)
public interface PreviewMapper {

    @Mapping(target = "targetPath", source = "recommendation.targetPath")
    @Mapping(target = "originalWorkflow", source = "originalText")
    @Mapping(target = "enhancedWorkflow", source = "mergedText")
    @Mapping(target = "insertionStart", source = "diff.insertionStart")
    @Mapping(target = "insertionLength", source = "diff.insertionLength")
    @Mapping(target = "diff", source = "diff.lines")
    PreviewResponse toResponse(EnhancementPreview preview);

    DiffLineResponse toDiffLineResponse(DiffLine line);
}
