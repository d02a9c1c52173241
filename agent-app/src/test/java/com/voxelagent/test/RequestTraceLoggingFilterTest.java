package com.voxelagent.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voxelagent.api.response.Response;
import com.voxelagent.config.ObservabilityHttpLogProperties;
import com.voxelagent.config.RequestTraceLoggingFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RequestTraceLoggingFilterTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        ObservabilityHttpLogProperties properties = new ObservabilityHttpLogProperties();
        properties.setEnabled(true);
        properties.setSampleRate(1.0D);

        RequestTraceLoggingFilter filter = new RequestTraceLoggingFilter(new ObjectMapper(), properties);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TestController())
                .addFilters(filter)
                .build();
    }

    @Test
    public void shouldInjectTraceHeadersForApiRequests() throws Exception {
        mockMvc.perform(get("/api/test/ping"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.code").value("0000"));
    }

    @Test
    public void shouldEchoIncomingTraceId() throws Exception {
        mockMvc.perform(get("/api/test/ping").header("X-Trace-Id", "trace-123"))
                .andExpect(header().string("X-Trace-Id", "trace-123"));
    }

    @Test
    public void shouldSkipPathsOutsideIncludePatterns() throws Exception {
        mockMvc.perform(get("/internal/ping"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"));
    }

    @RestController
    private static class TestController {

        @GetMapping("/api/test/ping")
        public Response<String> ping() {
            return Response.success("pong");
        }

        @GetMapping("/internal/ping")
        public Response<String> internalPing() {
            return Response.success("pong");
        }
    }
}
