package com.payshield.gleaner.api;

import com.payshield.gleaner.application.DetectionOrchestrator;
import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanRecord;
import com.payshield.gleaner.domain.GleanType;
import com.payshield.gleaner.domain.ports.GleanRepository;
import com.payshield.gleaner.exception.InvoiceDataException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GleanControllerTest {

    private DetectionOrchestrator orchestrator;
    private GleanRepository repository;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(DetectionOrchestrator.class);
        repository = mock(GleanRepository.class);
        mvc = MockMvcBuilders.standaloneSetup(new GleanController(orchestrator, repository)).build();
    }

    @Test
    void runReturnsSummary() throws Exception {
        UUID runId = UUID.randomUUID();
        when(orchestrator.run()).thenReturn(new DetectionOrchestrator.DetectionRun(
                runId, LocalDate.of(2020, 5, 1), 3, Map.of(GleanType.ACCRUAL_ALERT, 3L)));

        mvc.perform(post("/gleans/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(runId.toString()))
                .andExpect(jsonPath("$.asOf").value("2020-05-01"))
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.countsByType.accrual_alert").value(3));
    }

    @Test
    void badInputIsAClientError() throws Exception {
        when(orchestrator.run()).thenThrow(new InvoiceDataException("Input file not found: data/invoice.csv"));

        mvc.perform(post("/gleans/runs"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Input file not found: data/invoice.csv"));
    }

    @Test
    void listsGleansOfOneVendor() throws Exception {
        GleanRecord record = new GleanRecord(UUID.randomUUID(), Glean.forInvoice(LocalDate.of(2020, 4, 1),
                "First new bill in 3 months from vendor v1", GleanType.VENDOR_NOT_SEEN_IN_A_WHILE, "inv-5", "v1"));
        when(repository.findByVendor("v1", 0, 10)).thenReturn(List.of(record));

        mvc.perform(get("/gleans").param("vendorId", "v1").param("size", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].gleanType").value("vendor_not_seen_in_a_while"))
                .andExpect(jsonPath("$.items[0].gleanLocation").value("invoice"))
                .andExpect(jsonPath("$.items[0].invoiceId").value("inv-5"));
        verify(repository).findByVendor("v1", 0, 10);
    }

    @Test
    void rejectsOversizedPages() throws Exception {
        mvc.perform(get("/gleans").param("size", "501"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(repository);
    }
}
