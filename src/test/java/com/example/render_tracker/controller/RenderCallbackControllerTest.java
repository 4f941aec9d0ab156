package com.example.render_tracker.controller;

import com.example.render_tracker.dto.CallbackRequest;
import com.example.render_tracker.dto.CallbackResponse;
import com.example.render_tracker.exception.CallbackAuthenticationException;
import com.example.render_tracker.exception.CallbackValidationException;
import com.example.render_tracker.service.CallbackIngestor;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = RenderCallbackController.class)
@AutoConfigureMockMvc(addFilters = false)
class RenderCallbackControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CallbackIngestor callbackIngestor;

    @Test
    void snakeCaseBodyIsBoundAndAnswered() throws Exception {
        when(callbackIngestor.ingest(any())).thenReturn(CallbackResponse.ok("j1", "COMPLETED"));

        mockMvc.perform(post("/v1/jobs/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"job_id\":\"j1\",\"status\":\"completed\",\"output_url\":\"s3://b/k.mp4\",\"secret\":\"s\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.job_id").value("j1"))
                .andExpect(jsonPath("$.updated_status").value("COMPLETED"))
                .andExpect(jsonPath("$.message").doesNotExist());

        ArgumentCaptor<CallbackRequest> captor = ArgumentCaptor.forClass(CallbackRequest.class);
        verify(callbackIngestor).ingest(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new CallbackRequest("j1", "completed", "s3://b/k.mp4", null, "s"));
    }

    @Test
    void outputRefAliasIsAccepted() throws Exception {
        when(callbackIngestor.ingest(any())).thenReturn(CallbackResponse.skipped("Already processed"));

        mockMvc.perform(post("/v1/jobs/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"job_id\":\"j1\",\"status\":\"completed\",\"output_ref\":\"k.mp4\",\"secret\":\"s\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("skipped"))
                .andExpect(jsonPath("$.message").value("Already processed"))
                .andExpect(jsonPath("$.job_id").doesNotExist());

        ArgumentCaptor<CallbackRequest> captor = ArgumentCaptor.forClass(CallbackRequest.class);
        verify(callbackIngestor).ingest(captor.capture());
        assertThat(captor.getValue().outputUrl()).isEqualTo("k.mp4");
    }

    @Test
    void badSecretIs401() throws Exception {
        when(callbackIngestor.ingest(any())).thenThrow(new CallbackAuthenticationException());

        mockMvc.perform(post("/v1/jobs/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"job_id\":\"j1\",\"status\":\"completed\",\"secret\":\"x\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Unauthorized"));
    }

    @Test
    void validationErrorIs400() throws Exception {
        when(callbackIngestor.ingest(any())).thenThrow(new CallbackValidationException("Missing job_id or status"));

        mockMvc.perform(post("/v1/jobs/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secret\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Missing job_id or status"));
    }

    @Test
    void malformedJsonIs400() throws Exception {
        mockMvc.perform(post("/v1/jobs/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Malformed request body"));
    }

    @Test
    void emptyBodyIsTreatedAsUnauthenticated() throws Exception {
        when(callbackIngestor.ingest(isNull())).thenThrow(new CallbackAuthenticationException());

        mockMvc.perform(post("/v1/jobs/callback")
                        .contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Unauthorized"));

        verify(callbackIngestor).ingest(null);
    }
}
