package com.flagship.partnership_tax.simulation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.partnership_tax.observability.CorrelationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests for the simulation REST API.
 *
 * These tests verify:
 * - A full request is evaluated and scored
 * - Invalid requests are rejected with 400
 * - Invalid network configurations are rejected with 422
 * - The correlation ID is echoed back
 */
@SpringBootTest
@AutoConfigureMockMvc
class SimulationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private ObjectNode jonesFamily;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = new ClassPathResource("networks/jones-family.json").getInputStream()) {
            jonesFamily = (ObjectNode) objectMapper.readTree(in);
        }
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Test
    @DisplayName("Family network request is evaluated and scored")
    void testSimulateFamilyNetwork() throws Exception {
        printTestHeader("Simulate Family Network");

        // When
        String responseJson = mockMvc.perform(post("/api/simulations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(jonesFamily)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.simulation_id").exists())
            .andExpect(jsonPath("$.outcomes.length()").value(2))
            .andExpect(jsonPath("$.outcomes[0].applied").value(true))
            .andExpect(jsonPath("$.outcomes[1].applied").value(true))
            .andReturn()
            .getResponse()
            .getContentAsString();
        printOutput("Response", responseJson);

        // Then
        JsonNode response = objectMapper.readTree(responseJson);
        assertEquals(0, new BigDecimal("4999840.8").compareTo(response.get("fitness").decimalValue()));
        assertEquals(0, new BigDecimal("159.2").compareTo(response.get("total_tax").decimalValue()));
        assertEquals(0, new BigDecimal("156.816")
            .compareTo(response.get("tax_records").get("Mr. Jones").decimalValue()));
    }

    @Test
    @DisplayName("Rejected transaction is reported in the outcomes with status 200")
    void testRejectedTransactionReported() throws Exception {
        ObjectNode secondLeg = (ObjectNode) jonesFamily.get("transactions").get(1).get("good_to");
        secondLeg.put("amount", 2000000);

        mockMvc.perform(post("/api/simulations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(jonesFamily)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcomes[1].applied").value(false))
            .andExpect(jsonPath("$.outcomes[1].error_code").value("INSUFFICIENT_GOOD"))
            .andExpect(jsonPath("$.outcomes[1].details.entity").value("Mr. Brown"));
    }

    @Test
    @DisplayName("Missing transaction fields are rejected with 400")
    void testValidationFailure() throws Exception {
        ObjectNode first = (ObjectNode) jonesFamily.get("transactions").get(0);
        first.remove("entity_to");
        ((ObjectNode) first.get("good_from")).remove("entity");

        mockMvc.perform(post("/api/simulations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(jonesFamily)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details['transactions[0].entityTo']").exists())
            .andExpect(jsonPath("$.details['transactions[0].goodFrom.complete']").exists());
    }

    @Test
    @DisplayName("Malformed body is rejected with 400")
    void testMalformedBody() throws Exception {
        mockMvc.perform(post("/api/simulations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"network\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    @Test
    @DisplayName("Invalid network configuration is rejected with 422")
    void testInvalidConfiguration() throws Exception {
        ObjectNode partnership = (ObjectNode) jonesFamily.get("network").get("partnerships").get(0);
        partnership.put("downstream", "Mr. Jones");

        mockMvc.perform(post("/api/simulations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(jonesFamily)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("CYCLIC_OWNERSHIP"));
    }

    @Test
    @DisplayName("Correlation ID from the request is echoed in the response")
    void testCorrelationIdEchoed() throws Exception {
        mockMvc.perform(post("/api/simulations")
                .header(CorrelationContext.CORRELATION_ID_HEADER, "corr-123")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(jonesFamily)))
            .andExpect(status().isOk())
            .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, "corr-123"));
    }

    @Test
    @DisplayName("Health endpoint reports the configured rules")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(header().exists(CorrelationContext.CORRELATION_ID_HEADER));
    }
}
