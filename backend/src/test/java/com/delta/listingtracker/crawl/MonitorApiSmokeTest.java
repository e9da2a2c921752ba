package com.delta.listingtracker.crawl;

import com.delta.listingtracker.crawl.service.ActiveCrawlRunException;
import com.delta.listingtracker.crawl.service.CrawlOrchestratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class MonitorApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @MockBean
    private CrawlOrchestratorService crawlOrchestratorService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void crawlRunIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/crawl/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void crawlRunStartsAsynchronously() throws Exception {
        when(crawlOrchestratorService.startAsync(any())).thenReturn("run-abc");

        mockMvc.perform(post("/api/crawl/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"platforms\":[\"chrono24\"],\"maxPages\":2,\"snapshotDate\":\"2026-10-18\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.runId").value("run-abc"))
            .andExpect(jsonPath("$.status").value("started"));
    }

    @Test
    void activeRunIsConflict() throws Exception {
        when(crawlOrchestratorService.startAsync(any())).thenThrow(new ActiveCrawlRunException("Active crawl run in progress"));

        mockMvc.perform(post("/api/crawl/run"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("active_crawl_run"));
    }

    @Test
    void invertedSalesRangeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/sales").param("from", "2026-10-18").param("to", "2026-10-01"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void salesAndRunsReturnArrays() throws Exception {
        mockMvc.perform(get("/api/sales").param("from", "1999-01-01").param("to", "1999-01-31"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray())
            .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(get("/api/runs/recent").param("days", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }
}
