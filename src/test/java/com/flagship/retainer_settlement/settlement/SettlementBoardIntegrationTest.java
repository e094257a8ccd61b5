package com.flagship.retainer_settlement.settlement;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.UUID;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Settlement board over HTTP, against a real database.
 *
 * Each test uses its own session, so each has its own ledger and drag state.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class SettlementBoardIntegrationTest {

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
    private JdbcTemplate jdbcTemplate;

    private final UUID adminId = UUID.randomUUID();
    private MockHttpSession session;

    @BeforeEach
    void setUp() {
        session = new MockHttpSession();
    }

    @Test
    @DisplayName("The board lists the settlement stages in pipeline order")
    void stagesInOrder() throws Exception {
        mockMvc.perform(get("/api/settlements/stages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].label").value("Retainer Signed"))
                .andExpect(jsonPath("$[3].label").value("Paid to BPO"));
    }

    @Test
    @DisplayName("Moving a card persists the new status and writes a stage event")
    void moveCommits() throws Exception {
        UUID dealId = insertDeal("Retainer Signed", null);
        load();

        mockMvc.perform(asAdmin(post("/api/settlements/{id}/stage", dealId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stage\":\"Attorney Review\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("committed"))
                .andExpect(jsonPath("$.settlement.stage").value("attorney_review"))
                .andExpect(jsonPath("$.settlement.status").value("Attorney Review"));

        assertEquals("Attorney Review", statusOf(dealId));
        Integer events = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM outbox_events WHERE aggregate_id = ? AND event_type = 'DealStageChanged'",
                Integer.class, dealId);
        assertEquals(1, events);
    }

    @Test
    @DisplayName("Dropping a card on its own column changes nothing")
    void sameColumnIsNoOp() throws Exception {
        UUID dealId = insertDeal("Attorney Review", null);
        load();

        mockMvc.perform(asAdmin(post("/api/settlements/{id}/stage", dealId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stage\":\"Attorney Review\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("no_op_same_column"));

        Integer events = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM outbox_events WHERE aggregate_id = ?", Integer.class, dealId);
        assertEquals(0, events);
    }

    @Test
    @DisplayName("The BPO cannot be paid before the inbound payment is received")
    void safetyLock() throws Exception {
        UUID dealId = insertDeal("Approved – Payable", null);
        load();

        mockMvc.perform(asAdmin(post("/api/settlements/{id}/pay-outbound", dealId)))
                .andExpect(status().isConflict());
        assertEquals("Approved – Payable", statusOf(dealId));

        mockMvc.perform(asAdmin(post("/api/settlements/{id}/inbound-received", dealId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied").value(true))
                .andExpect(jsonPath("$.settlement.inbound_payment_status").value("received"))
                .andExpect(jsonPath("$.settlement.can_pay_outbound").value(true));

        mockMvc.perform(asAdmin(post("/api/settlements/{id}/pay-outbound", dealId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("paid_to_bpo"))
                .andExpect(jsonPath("$.outbound_payment_status").value("paid"))
                .andExpect(jsonPath("$.can_pay_outbound").value(false));
        assertEquals("Paid to BPO", statusOf(dealId));
    }

    @Test
    @DisplayName("Unknown target stages are rejected")
    void unknownStage() throws Exception {
        UUID dealId = insertDeal("Retainer Signed", null);
        load();

        mockMvc.perform(asAdmin(post("/api/settlements/{id}/stage", dealId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stage\":\"Closed Won\"}"))
                .andExpect(status().isBadRequest());
        assertEquals("Retainer Signed", statusOf(dealId));
    }

    @Test
    @DisplayName("Lawyers only see their own deals and cannot move them")
    void lawyerAccess() throws Exception {
        UUID lawyerId = UUID.randomUUID();
        UUID own = insertDeal("Attorney Review", lawyerId);
        UUID other = insertDeal("Attorney Review", UUID.randomUUID());

        mockMvc.perform(get("/api/settlements").session(session)
                        .header("X-User-Id", lawyerId.toString())
                        .header("X-User-Role", "lawyer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.deal_id == '" + own + "')]", not(empty())))
                .andExpect(jsonPath("$[?(@.deal_id == '" + other + "')]", empty()));

        mockMvc.perform(post("/api/settlements/{id}/stage", own).session(session)
                        .header("X-User-Id", lawyerId.toString())
                        .header("X-User-Role", "lawyer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stage\":\"Approved – Payable\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Requests without caller headers or with an unknown role are refused")
    void callerHeaders() throws Exception {
        mockMvc.perform(get("/api/settlements").session(session))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing Required Header"));

        mockMvc.perform(get("/api/settlements").session(session)
                        .header("X-User-Id", adminId.toString())
                        .header("X-User-Role", "intern"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Loading the board shows each deal with its derived payment state")
    void loadShowsDerivedState() throws Exception {
        UUID paid = insertDeal("Paid to BPO", null);

        mockMvc.perform(asAdmin(get("/api/settlements")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.deal_id == '" + paid + "')].outbound_payment_status", contains("paid")))
                .andExpect(jsonPath("$[?(@.deal_id == '" + paid + "')].can_pay_outbound", contains(false)));
    }

    private void load() throws Exception {
        mockMvc.perform(asAdmin(get("/api/settlements"))).andExpect(status().isOk());
    }

    private MockHttpServletRequestBuilder asAdmin(MockHttpServletRequestBuilder request) {
        return request.session(session)
                .header("X-User-Id", adminId.toString())
                .header("X-User-Role", "admin");
    }

    private UUID insertDeal(String status, UUID attorneyId) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("""
                INSERT INTO daily_deal_flow (id, submission_id, insured_name, lead_vendor, date, status, assigned_attorney_id)
                VALUES (?, ?, 'Jane Roe', 'Acme Leads', CURRENT_DATE, ?, ?)
                """, id, "SUB-" + id.toString().substring(0, 8), status, attorneyId);
        return id;
    }

    private String statusOf(UUID dealId) {
        return jdbcTemplate.queryForObject("SELECT status FROM daily_deal_flow WHERE id = ?", String.class, dealId);
    }
}
