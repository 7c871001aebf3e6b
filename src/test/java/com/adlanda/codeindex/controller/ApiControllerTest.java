package com.adlanda.codeindex.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ApiController.class)
class ApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void rootEndpoint_returnsServiceInfo() throws Exception {
        mockMvc.perform(get("/api/v1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("Code Vector Index"))
                .andExpect(jsonPath("$.endpoints").exists());
    }

    @Test
    void rootEndpoint_includesAllEndpoints() throws Exception {
        mockMvc.perform(get("/api/v1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints.index").exists())
                .andExpect(jsonPath("$.endpoints.indexStream").exists())
                .andExpect(jsonPath("$.endpoints.purge").exists())
                .andExpect(jsonPath("$.endpoints.search").exists())
                .andExpect(jsonPath("$.endpoints.health").exists());
    }
}
