package fr.imt.scanzilla.scanzilla.presentation.web;

import fr.imt.scanzilla.scanzilla.business.model.AnalysisBatch;
import fr.imt.scanzilla.scanzilla.business.service.BatchAnalysisService;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.AnalysisBatchResponse;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.AnalysisRequest;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.mappers.AnalysisMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/analyses")
@RequiredArgsConstructor
public class AnalysisController {

    private final BatchAnalysisService batchAnalysisService;
    private final AnalysisMapper analysisMapper;

    @PostMapping
    public ResponseEntity<HttpResponse<AnalysisBatchResponse>> startAnalysis(@Valid @RequestBody AnalysisRequest request) {
        AnalysisBatch batch = batchAnalysisService.start(request.getRepositories());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(HttpResponse.success(analysisMapper.toBatchResponse(batch)));
    }

    @GetMapping("/{batchId}")
    public ResponseEntity<HttpResponse<AnalysisBatchResponse>> getAnalysis(@PathVariable("batchId") String batchId) {
        AnalysisBatch batch = batchAnalysisService.getBatch(batchId);
        return ResponseEntity.ok(HttpResponse.success(analysisMapper.toBatchResponse(batch)));
    }

    @PostMapping("/{batchId}/cancel")
    public ResponseEntity<HttpResponse<AnalysisBatchResponse>> cancelAnalysis(@PathVariable("batchId") String batchId) {
        AnalysisBatch batch = batchAnalysisService.cancel(batchId);
        return ResponseEntity.ok(HttpResponse.success(analysisMapper.toBatchResponse(batch)));
    }
}
