package com.flagship.retainer_settlement.invoice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Invoice authoring, linking and payment over HTTP, against a real database.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class InvoiceLifecycleIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("retainer_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final UUID adminId = UUID.randomUUID();

    @Test
    @DisplayName("Creating a lawyer invoice numbers it, computes totals and links its deals")
    void createLawyerInvoice() throws Exception {
        UUID lawyerId = UUID.randomUUID();
        UUID first = insertDeal("Attorney Review", lawyerId, "Acme Leads");
        UUID second = insertDeal("Attorney Review", lawyerId, "Acme Leads");

        mockMvc.perform(asAdmin(post("/api/invoices"))
                        .header("Idempotency-Key", UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(lawyerInvoiceJson(lawyerId, List.of(first, second))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.invoice_number", matchesPattern("INV-\\d{4}-\\d{4}")))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.invoice_type").value("lawyer"))
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.subtotal").value(200.00))
                .andExpect(jsonPath("$.tax_amount").value(16.00))
                .andExpect(jsonPath("$.total_amount").value(216.00))
                .andExpect(jsonPath("$.created_by").value(adminId.toString()));

        assertNotNull(linkedLawyerInvoice(first));
        assertEquals(linkedLawyerInvoice(first), linkedLawyerInvoice(second));
    }

    @Test
    @DisplayName("The request's correlation ID is echoed and stored with the invoice's outbox event")
    void correlationIdTravelsWithEvent() throws Exception {
        UUID lawyerId = UUID.randomUUID();
        UUID dealId = insertDeal("Attorney Review", lawyerId, "Acme Leads");

        String response = mockMvc.perform(asAdmin(post("/api/invoices"))
                        .header("Idempotency-Key", UUID.randomUUID().toString())
                        .header("X-Correlation-ID", "billing-run-17")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(lawyerInvoiceJson(lawyerId, List.of(dealId))))
                .andExpect(status().isCreated())
                .andExpect(header().string("X-Correlation-ID", "billing-run-17"))
                .andReturn().getResponse().getContentAsString();
        UUID invoiceId = UUID.fromString(objectMapper.readTree(response).get("id").asText());

        String stored = jdbcTemplate.queryForObject(
                "SELECT correlation_id FROM outbox_events WHERE aggregate_id = ? AND event_type = 'InvoiceCreated'",
                String.class, invoiceId);
        assertEquals("billing-run-17", stored);
    }

    @Test
    @DisplayName("Repeating a create with the same idempotency key returns the first invoice")
    void idempotentCreate() throws Exception {
        UUID lawyerId = UUID.randomUUID();
        UUID dealId = insertDeal("Attorney Review", lawyerId, "Acme Leads");
        String key = UUID.randomUUID().toString();
        String body = lawyerInvoiceJson(lawyerId, List.of(dealId));

        String first = mockMvc.perform(asAdmin(post("/api/invoices"))
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String invoiceId = objectMapper.readTree(first).get("id").asText();

        mockMvc.perform(asAdmin(post("/api/invoices"))
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(invoiceId));

        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM invoices WHERE idempotency_key = ?", Integer.class, key);
        assertEquals(1, count);
    }

    @Test
    @DisplayName("Incomplete invoices are rejected with every problem listed")
    void incompleteInvoiceRejected() throws Exception {
        mockMvc.perform(asAdmin(post("/api/invoices"))
                        .header("Idempotency-Key", UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"invoice_type\":\"lawyer\",\"items\":[{\"description\":\"\",\"quantity\":1,\"unit_price\":10}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invoice Not Submittable"));
    }

    @Test
    @DisplayName("Creating without an idempotency key is refused")
    void idempotencyKeyRequired() throws Exception {
        mockMvc.perform(asAdmin(post("/api/invoices"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(lawyerInvoiceJson(UUID.randomUUID(), List.of())))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Editing replaces the linked deal set")
    void editRelinks() throws Exception {
        UUID lawyerId = UUID.randomUUID();
        UUID kept = insertDeal("Attorney Review", lawyerId, "Acme Leads");
        UUID dropped = insertDeal("Attorney Review", lawyerId, "Acme Leads");
        UUID added = insertDeal("Attorney Review", lawyerId, "Acme Leads");
        UUID invoiceId = createInvoice(lawyerInvoiceJson(lawyerId, List.of(kept, dropped)));

        mockMvc.perform(asAdmin(put("/api/invoices/{id}", invoiceId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(lawyerInvoiceJson(lawyerId, List.of(kept, added))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deal_ids", hasSize(2)));

        assertEquals(invoiceId, linkedLawyerInvoice(kept));
        assertEquals(invoiceId, linkedLawyerInvoice(added));
        assertNull(linkedLawyerInvoice(dropped));
    }

    @Test
    @DisplayName("Deals billed by another invoice are not linked again")
    void alreadyBilledDealsAreNotStolen() throws Exception {
        UUID lawyerId = UUID.randomUUID();
        UUID billed = insertDeal("Attorney Review", lawyerId, "Acme Leads");
        UUID firstInvoice = createInvoice(lawyerInvoiceJson(lawyerId, List.of(billed)));

        mockMvc.perform(asAdmin(post("/api/invoices"))
                        .header("Idempotency-Key", UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(lawyerInvoiceJson(lawyerId, List.of(billed))))
                .andExpect(status().isConflict());

        assertEquals(firstInvoice, linkedLawyerInvoice(billed));
    }

    @Test
    @DisplayName("Paying a publisher invoice moves its deals to Paid to BPO")
    void payPublisherInvoice() throws Exception {
        UUID centerId = UUID.randomUUID();
        String vendor = "Vendor " + centerId;
        jdbcTemplate.update("INSERT INTO centers (id, name, lead_vendor) VALUES (?, ?, ?)", centerId, vendor, vendor);
        UUID dealId = insertDeal("Approved – Payable", null, vendor);

        mockMvc.perform(asAdmin(get("/api/invoices/eligible-deals"))
                        .param("type", "publisher")
                        .param("counterparty_id", centerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(dealId.toString()));

        UUID invoiceId = createInvoice(publisherInvoiceJson(centerId, List.of(dealId)));

        mockMvc.perform(asAdmin(post("/api/invoices/{id}/paid", invoiceId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("paid"));

        assertEquals("Paid to BPO", jdbcTemplate.queryForObject(
                "SELECT status FROM daily_deal_flow WHERE id = ?", String.class, dealId));

        mockMvc.perform(asAdmin(put("/api/invoices/{id}", invoiceId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(publisherInvoiceJson(centerId, List.of(dealId))))
                .andExpect(status().isConflict());

        mockMvc.perform(asAdmin(post("/api/invoices/{id}/chargeback", invoiceId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("chargeback"));

        List<String> events = jdbcTemplate.queryForList(
                "SELECT event_type FROM outbox_events WHERE aggregate_id = ? ORDER BY sequence_number",
                String.class, invoiceId);
        assertEquals(List.of("InvoiceCreated", "InvoiceStatusChanged", "InvoiceStatusChanged"), events);
    }

    // Deleting lowers this year's invoice count, so the next number drawn could collide. Keep it last.
    @Test
    @Order(Integer.MAX_VALUE)
    @DisplayName("Deleting an invoice frees its deals")
    void deleteFreesDeals() throws Exception {
        UUID lawyerId = UUID.randomUUID();
        UUID dealId = insertDeal("Attorney Review", lawyerId, "Acme Leads");
        UUID invoiceId = createInvoice(lawyerInvoiceJson(lawyerId, List.of(dealId)));

        mockMvc.perform(asAdmin(delete("/api/invoices/{id}", invoiceId)))
                .andExpect(status().isNoContent());

        assertNull(linkedLawyerInvoice(dealId));
        mockMvc.perform(asAdmin(get("/api/invoices/{id}", invoiceId)))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("A lawyer sees only their own invoices")
    void lawyerVisibility() throws Exception {
        UUID lawyerId = UUID.randomUUID();
        UUID own = createInvoice(lawyerInvoiceJson(lawyerId, List.of()));
        UUID other = createInvoice(lawyerInvoiceJson(UUID.randomUUID(), List.of()));

        String listed = mockMvc.perform(get("/api/invoices")
                        .header("X-User-Id", lawyerId.toString())
                        .header("X-User-Role", "lawyer"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        List<String> ids = idsOf(objectMapper.readTree(listed));
        assertEquals(List.of(own.toString()), ids);

        mockMvc.perform(get("/api/invoices/{id}", other)
                        .header("X-User-Id", lawyerId.toString())
                        .header("X-User-Role", "lawyer"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("The next-number preview follows the invoice numbering format")
    void nextNumber() throws Exception {
        mockMvc.perform(asAdmin(get("/api/invoices/next-number")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invoice_number", matchesPattern("INV-\\d{4}-\\d{4}")));
    }

    private UUID createInvoice(String body) throws Exception {
        String response = mockMvc.perform(asAdmin(post("/api/invoices"))
                        .header("Idempotency-Key", UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return UUID.fromString(objectMapper.readTree(response).get("id").asText());
    }

    private MockHttpServletRequestBuilder asAdmin(MockHttpServletRequestBuilder request) {
        return request.header("X-User-Id", adminId.toString()).header("X-User-Role", "admin");
    }

    private UUID insertDeal(String status, UUID attorneyId, String leadVendor) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("""
                INSERT INTO daily_deal_flow (id, submission_id, insured_name, lead_vendor, date, status, assigned_attorney_id)
                VALUES (?, ?, 'John Doe', ?, CURRENT_DATE, ?, ?)
                """, id, "SUB-" + id.toString().substring(0, 8), leadVendor, status, attorneyId);
        return id;
    }

    private UUID linkedLawyerInvoice(UUID dealId) {
        return jdbcTemplate.queryForObject("SELECT invoice_id FROM daily_deal_flow WHERE id = ?", UUID.class, dealId);
    }

    private static List<String> idsOf(JsonNode array) {
        List<String> ids = new ArrayList<>();
        array.forEach(node -> ids.add(node.get("id").asText()));
        return ids;
    }

    private static String lawyerInvoiceJson(UUID lawyerId, List<UUID> dealIds) {
        return """
                {"invoice_type":"lawyer","lawyer_id":"%s","date_range_start":"2024-06-01","date_range_end":"2024-06-30",
                 "due_date":"2024-07-15","deal_ids":[%s],
                 "items":[{"description":"Fee","quantity":2,"unit_price":100}],"tax_rate":0.08}
                """.formatted(lawyerId, quoted(dealIds));
    }

    private static String publisherInvoiceJson(UUID centerId, List<UUID> dealIds) {
        return """
                {"invoice_type":"publisher","lead_vendor_id":"%s","date_range_start":"2024-06-01","date_range_end":"2024-06-30",
                 "due_date":"2024-07-15","deal_ids":[%s],
                 "items":[{"description":"Leads","quantity":3,"unit_price":45}]}
                """.formatted(centerId, quoted(dealIds));
    }

    private static String quoted(List<UUID> ids) {
        return ids.stream().map(id -> "\"" + id + "\"").collect(Collectors.joining(","));
    }
}
