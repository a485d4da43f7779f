package com.siteaudit.scan.api;

import com.jayway.jsonpath.JsonPath;
import com.siteaudit.scan.browser.BrowserEngine;
import com.siteaudit.scan.browser.BrowserSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ScanApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @MockBean
    private BrowserEngine browserEngine;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void healthEndpointAnswersOk() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void invalidUrlIsRejected() throws Exception {
        mockMvc.perform(post("/api/scans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"not a url\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_url"));

        mockMvc.perform(post("/api/scans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("url is required"));
    }

    @Test
    void unknownScanIsNotFound() throws Exception {
        mockMvc.perform(get("/api/scans/does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("scan_not_found"));
    }

    @Test
    void submittedScanCanBePolled() throws Exception {
        MvcResult submitted = mockMvc.perform(post("/api/scans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"http://localhost:1/\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("pending"))
            .andReturn();
        String scanId = JsonPath.read(submitted.getResponse().getContentAsString(), "$.scanId");

        mockMvc.perform(get("/api/scans/" + scanId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.job.id").value(scanId))
            .andExpect(jsonPath("$.job.targetUrl").value("http://localhost:1/"));
    }

    @Test
    void browserHealthReportsPoolState() throws Exception {
        BrowserSession session = mock(BrowserSession.class);
        when(session.isConnected()).thenReturn(true);
        when(browserEngine.launch()).thenReturn(session);

        mockMvc.perform(get("/api/browser/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.healthy").value(true))
            .andExpect(jsonPath("$.pool.maxPages").isNumber());
    }
}
