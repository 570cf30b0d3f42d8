package com.example.servicerota.common;

import com.example.servicerota.common.error.ErrorLogBuffer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ErrorLogBuffer errorLogBuffer;

    @Test
    void health_isUp() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("UP"));
    }

    @Test
    void recordedErrorsAreListedNewestFirstAndCanBeCleared() throws Exception {
        errorLogBuffer.clear();
        errorLogBuffer.addError("first", new IllegalStateException("boom"));
        errorLogBuffer.addError("second", null);

        mockMvc.perform(get("/api/health/errors"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.count").value(2))
            .andExpect(jsonPath("$.data[0].message").value("second"))
            .andExpect(jsonPath("$.data[1].detail").value("java.lang.IllegalStateException: boom"));

        mockMvc.perform(delete("/api/health/errors"))
            .andExpect(status().isOk());
        assertThat(errorLogBuffer.recent()).isEmpty();
    }
}
