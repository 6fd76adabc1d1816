package com.security.subgraph.controller;

import com.security.subgraph.TelemetryFixtures;
import com.security.subgraph.exception.SinkException;
import com.security.subgraph.service.SubgraphGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 子图生成接口测试
 */
public class SubgraphControllerTest {

    @Mock
    private SubgraphGenerator subgraphGenerator;

    @InjectMocks
    private SubgraphController controller;

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    public void testGenerate() throws Exception {
        when(subgraphGenerator.handleEvent(any())).thenReturn(TelemetryFixtures.emptyBatch());

        mockMvc.perform(post("/api/subgraph/generate")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("line-1\nline-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subgraphs").value(0))
                .andExpect(jsonPath("$.edges").value(0));

        verify(subgraphGenerator, times(1)).handleEvent(any());
    }

    @Test
    public void testSinkFailureReturnsBadGateway() throws Exception {
        when(subgraphGenerator.handleEvent(any())).thenThrow(new SinkException("es down"));

        mockMvc.perform(post("/api/subgraph/generate")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[]{1, 2, 3}))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("es down"));
    }
}
