package fr.imt.scanzilla.scanzilla.presentation.web;

import fr.imt.scanzilla.scanzilla.business.model.AnalysisBatch;
import fr.imt.scanzilla.scanzilla.business.service.BatchAnalysisService;
import fr.imt.scanzilla.scanzilla.exception.BatchNotFoundException;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.AnalysisBatchResponse;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.RepositoryAnalysisResponse;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.SecurityToolResponse;
import fr.imt.scanzilla.scanzilla.presentation.web.dto.mappers.AnalysisMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    @Mock
    private BatchAnalysisService batchAnalysisService;

    @Mock
    private AnalysisMapper analysisMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AnalysisController(batchAnalysisService, analysisMapper))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static AnalysisBatchResponse response(String id, String status) {
        AnalysisBatchResponse response = new AnalysisBatchResponse();
        response.setId(id);
        response.setStatus(status);
        response.setTotalRepositories(2);
        response.setAnalyses(List.of());
        return response;
    }

    @Test
    void startAnalysis_ValidRequest_Accepted() throws Exception {
        AnalysisBatch batch = new AnalysisBatch("batch-1", List.of("acme/api", "acme/web"));
        when(batchAnalysisService.start(List.of("acme/api", "acme/web"))).thenReturn(batch);
        when(analysisMapper.toBatchResponse(batch)).thenReturn(response("batch-1", "RUNNING"));

        mockMvc.perform(post("/api/v1/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"repositories\": [\"acme/api\", \"acme/web\"]}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value("batch-1"))
                .andExpect(jsonPath("$.data.status").value("RUNNING"))
                .andExpect(jsonPath("$.data.totalRepositories").value(2))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void startAnalysis_NoRepositories_BadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"repositories\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        verifyNoInteractions(batchAnalysisService);
    }

    @Test
    void startAnalysis_MalformedBody_BadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"repositories\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"));
    }

    @Test
    void startAnalysis_NotJson_UnsupportedMediaType() throws Exception {
        mockMvc.perform(post("/api/v1/analyses")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("acme/api"))
                .andExpect(status().isUnsupportedMediaType());
    }

    @Test
    void getAnalysis_ReportsScanCoverage() throws Exception {
        AnalysisBatch batch = new AnalysisBatch("batch-1", List.of("acme/api"));
        SecurityToolResponse tool = new SecurityToolResponse();
        tool.setWorkflowPath(".github/workflows/ci.yml");
        tool.setJobId("build");
        tool.setStepName("Polaris Security Scan");
        tool.setTool("polaris");
        RepositoryAnalysisResponse analysis = new RepositoryAnalysisResponse();
        analysis.setRepository("acme/api");
        analysis.setStatus("ANALYZED");
        analysis.setCoverageStatus("CONFIGURED");
        analysis.setSecurityTools(List.of(tool));
        analysis.setDuplicates(List.of());
        analysis.setPolarisConfigFiles(List.of("polaris.yml"));
        analysis.setPolarisInRoot(true);
        analysis.setRecommendations(List.of());
        AnalysisBatchResponse response = response("batch-1", "COMPLETED");
        response.setAnalyses(List.of(analysis));
        when(batchAnalysisService.getBatch("batch-1")).thenReturn(batch);
        when(analysisMapper.toBatchResponse(batch)).thenReturn(response);

        mockMvc.perform(get("/api/v1/analyses/batch-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.analyses[0].coverageStatus").value("CONFIGURED"))
                .andExpect(jsonPath("$.data.analyses[0].securityTools[0].jobId").value("build"))
                .andExpect(jsonPath("$.data.analyses[0].securityTools[0].tool").value("polaris"))
                .andExpect(jsonPath("$.data.analyses[0].polarisInRoot").value(true))
                .andExpect(jsonPath("$.data.analyses[0].polarisConfigFiles[0]").value("polaris.yml"));
    }

    @Test
    void getAnalysis_UnknownBatch_NotFound() throws Exception {
        when(batchAnalysisService.getBatch("missing")).thenThrow(new BatchNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/analyses/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Analysis batch not found with ID: missing"));
    }

    @Test
    void cancelAnalysis_ReturnsBatch() throws Exception {
        AnalysisBatch batch = new AnalysisBatch("batch-1", List.of("acme/api"));
        batch.cancel();
        when(batchAnalysisService.cancel("batch-1")).thenReturn(batch);
        when(analysisMapper.toBatchResponse(any())).thenReturn(response("batch-1", "CANCELLED"));

        mockMvc.perform(post("/api/v1/analyses/batch-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));
    }

    @Test
    void wrongVerb_MethodNotAllowed() throws Exception {
        mockMvc.perform(put("/api/v1/analyses/batch-1"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("Method Not Allowed"));
    }
}
