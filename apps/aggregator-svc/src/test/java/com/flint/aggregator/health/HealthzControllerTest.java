package com.flint.aggregator.health;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class HealthzControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Test
    void healthzReturnsUp() throws Exception {
        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void accountsRequireAUser() throws Exception {
        mockMvc.perform(get("/accounts"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    @Test
    void accountsForAFreshUserAreEmpty() throws Exception {
        mockMvc.perform(get("/accounts")
                        .header("X-User-Id", "0f8fad5b-d9cb-469f-a165-70867728950e")
                        .header("X-Request-Trace", "trace-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Trace", "trace-123"))
                .andExpect(jsonPath("$.accounts").isEmpty())
                .andExpect(jsonPath("$.traceId").value("trace-123"));
    }
}
