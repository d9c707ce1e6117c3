package com.tarterware.infrafinder.controllers;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.tarterware.infrafinder.components.InfrastructureRegistry;
import com.tarterware.infrafinder.components.InfrastructureSnapshot;
import com.tarterware.infrafinder.exceptions.FatalStartupException;
import com.tarterware.infrafinder.models.DatasetKind;
import com.tarterware.infrafinder.models.DatasetStatistics;
import com.tarterware.infrafinder.models.IngestionReport;

import utils.TestUtils;

class AdminControllerTest
{
    @Mock
    private InfrastructureRegistry registry;

    @InjectMocks
    private AdminController adminController;

    private MockMvc mockMvc;

    @BeforeEach
    void setup()
    {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(adminController)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static InfrastructureSnapshot snapshot()
    {
        DatasetStatistics lighting = new DatasetStatistics(DatasetKind.LIGHTING);
        lighting.setPresent(true);
        lighting.setRowsRead(5);
        lighting.setRowsAccepted(3);
        lighting.setRowsMalformed(1);
        lighting.setRowsWithoutGeometry(1);

        return new InfrastructureSnapshot(
                TestUtils.store(TestUtils.segment("1001", TestUtils.horizontalLine(0, 0, 10), DatasetKind.LIGHTING)),
                IngestionReport.builder().dataset(lighting).completedAt(Instant.parse("2025-08-01T12:00:00Z")).build());
    }

    @Test
    void testStatus() throws Exception
    {
        when(registry.current()).thenReturn(snapshot());

        mockMvc.perform(get("/api/admin/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.segmentCount").value(1))
                .andExpect(jsonPath("$.indexedSegmentCount").value(1))
                .andExpect(jsonPath("$.totalRowsAccepted").value(3))
                .andExpect(jsonPath("$.totalRowsSkipped").value(2))
                .andExpect(jsonPath("$.datasets[0].kind").value("LIGHTING"))
                .andExpect(jsonPath("$.datasets[0].present").value(true));
    }

    @Test
    void testReload() throws Exception
    {
        when(registry.reload()).thenReturn(snapshot());

        mockMvc.perform(post("/api/admin/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.segmentCount").value(1));
    }

    @Test
    void testFailedReload() throws Exception
    {
        when(registry.reload()).thenThrow(new FatalStartupException("Aggregation produced no segments"));

        mockMvc.perform(post("/api/admin/reload"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value(ApiExceptionHandler.RELOAD_FAILED))
                .andExpect(jsonPath("$.message").value("Aggregation produced no segments"));
    }
}
