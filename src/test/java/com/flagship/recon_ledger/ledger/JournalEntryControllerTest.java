package com.flagship.recon_ledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Journal entry API tests.
 *
 * These tests verify:
 * - Drafts are created and posted through the API
 * - Ledger validation failures come back as 422 with the failure code and delta
 * - Posted entries are frozen and cannot be posted twice
 * - Malformed requests and unknown entries are rejected
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class JournalEntryControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("recon_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("reconciliation.consistency.schedule-enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AccountService accountService;

    private UUID bankId;
    private UUID revenueId;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        bankId = accountService.createAccount("BANK-" + suffix, "Bank", AccountType.ASSET, "USD").getId();
        revenueId = accountService.createAccount("REV-" + suffix, "Revenue", AccountType.INCOME, "USD").getId();
    }

    @Test
    @DisplayName("Balanced draft is created and posted")
    void testCreateAndPost() throws Exception {
        JsonNode draft = createDraft("5000.00", "5000.00");
        assertEquals("DRAFT", draft.get("status").asText());
        assertEquals(0, draft.get("version").asLong());

        mockMvc.perform(post("/api/journal-entries/{id}/post", draft.get("id").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(versionBody(draft)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("POSTED"))
                .andExpect(jsonPath("$.lines.length()").value(2));
    }

    @Test
    @DisplayName("Imbalanced draft is refused with IMBALANCED and the delta")
    void testImbalancedPostReturns422() throws Exception {
        JsonNode draft = createDraft("5000.00", "4999.99");

        MvcResult result = mockMvc.perform(post("/api/journal-entries/{id}/post", draft.get("id").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(versionBody(draft)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("IMBALANCED"))
                .andReturn();

        JsonNode error = objectMapper.readTree(result.getResponse().getContentAsString());
        assertEquals(0, new BigDecimal("0.01").compareTo(new BigDecimal(error.get("details").get("delta").asText())));

        mockMvc.perform(get("/api/journal-entries/{id}", draft.get("id").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DRAFT"));
    }

    @Test
    @DisplayName("Posted entry cannot be edited or posted again")
    void testPostedEntryIsFrozen() throws Exception {
        JsonNode draft = createDraft("80.00", "80.00");
        String id = draft.get("id").asText();
        mockMvc.perform(post("/api/journal-entries/{id}/post", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(versionBody(draft)))
                .andExpect(status().isOk());

        mockMvc.perform(put("/api/journal-entries/{id}/lines", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"version\":1," + linesJson("1.00", "1.00") + "}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("ENTRY_NOT_EDITABLE"));

        mockMvc.perform(post("/api/journal-entries/{id}/post", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"version\":1}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_PROCESSED"));
    }

    @Test
    @DisplayName("Missing entry date is a 400, unknown entry a 404")
    void testBadRequests() throws Exception {
        mockMvc.perform(post("/api/journal-entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + linesJson("1.00", "1.00") + "}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(get("/api/journal-entries/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Line amount with more than four decimal places is a 400")
    void testAmountScaleRejected() throws Exception {
        mockMvc.perform(post("/api/journal-entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entry_date\":\"2024-03-01\"," + linesJson("0.00005", "0.00005") + "}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.details['lines[0].amount']").exists());
    }

    private JsonNode createDraft(String debit, String credit) throws Exception {
        String body = "{\"entry_date\":\"2024-03-01\",\"memo\":\"Invoice\"," + linesJson(debit, credit) + "}";
        MvcResult result = mockMvc.perform(post("/api/journal-entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String linesJson(String debit, String credit) {
        return String.format("\"lines\":["
                + "{\"account_id\":\"%s\",\"direction\":\"DEBIT\",\"amount\":%s,\"currency\":\"USD\"},"
                + "{\"account_id\":\"%s\",\"direction\":\"CREDIT\",\"amount\":%s,\"currency\":\"USD\"}]",
                bankId, debit, revenueId, credit);
    }

    private String versionBody(JsonNode entry) {
        return "{\"version\":" + entry.get("version").asLong() + "}";
    }
}
