package fr.imt.scanzilla.scanzilla.presentation.web;

import fr.imt.scanzilla.scanzilla.business.model.EnhancementPreview;
import fr.imt.scanzilla.scanzilla.business.service.EnhancementPreviewService;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.PreviewRequest;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.PreviewResponse;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.mappers.PreviewMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/enhancements")
@RequiredArgsConstructor
public class EnhancementController {

    private final EnhancementPreviewService enhancementPreviewService;
    private final PreviewMapper previewMapper;

    @PostMapping("/preview")
    public ResponseEntity<HttpResponse<PreviewResponse>> preview(@Valid @RequestBody PreviewRequest request) {
        EnhancementPreview preview = enhancementPreviewService.preview(request.getRepository(), request.getFragmentId());
        return ResponseEntity.ok(HttpResponse.success(previewMapper.toResponse(preview)));
    }
}
