package com.example.render_tracker.config;

import com.example.render_tracker.controller.JobStatusController;
import com.example.render_tracker.controller.RenderCallbackController;
import com.example.render_tracker.dispatch.OutboundDispatcher;
import com.example.render_tracker.dto.CallbackResponse;
import com.example.render_tracker.dto.JobStatusResponse;
import com.example.render_tracker.service.CallbackIngestor;
import com.example.render_tracker.service.StatusReconciler;
import com.example.render_tracker.store.JobStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {JobStatusController.class, RenderCallbackController.class})
@Import(WebSecurityConfig.class)
class WebSecurityConfigTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StatusReconciler statusReconciler;

    @MockitoBean
    private JobStore jobStore;

    @MockitoBean
    private OutboundDispatcher dispatcher;

    @MockitoBean
    private CallbackIngestor callbackIngestor;

    @Test
    void statusWithoutTokenIs401() throws Exception {
        mockMvc.perform(get("/v1/jobs/j1/status"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Not authenticated"));

        verifyNoInteractions(statusReconciler);
    }

    @Test
    void statusWithWrongTokenIs401() throws Exception {
        mockMvc.perform(get("/v1/jobs/j1/status").header(HttpHeaders.AUTHORIZATION, "Bearer nope"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void statusWithConfiguredTokenIsServed() throws Exception {
        when(statusReconciler.reconcile("j1")).thenReturn(JobStatusResponse.completed("https://cdn/x.mp4"));

        mockMvc.perform(get("/v1/jobs/j1/status").header(HttpHeaders.AUTHORIZATION, "Bearer test-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"));
    }

    @Test
    void callbackDoesNotNeedBearerToken() throws Exception {
        when(callbackIngestor.ingest(any())).thenReturn(CallbackResponse.ok("j1", "FAILED"));

        mockMvc.perform(post("/v1/jobs/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"job_id\":\"j1\",\"status\":\"failed\",\"secret\":\"modal-secret\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated_status").value("FAILED"));
    }
}
