package com.assetdesk.backend.modules.accessory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.assetdesk.backend.support.AbstractPostgresIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AccessoryIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String ACTOR_HEADER = "X-Actor-Id";
    private static final String ACTOR = "1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private long minaId;
    private long joonId;

    @BeforeEach
    void setUp() {
        minaId = jdbcTemplate.queryForObject(
                "INSERT INTO users (name, email) VALUES ('Mina Park', 'mina@example.com') RETURNING id", Long.class);
        joonId = jdbcTemplate.queryForObject(
                "INSERT INTO users (name, email) VALUES ('Joon Lee', 'joon@example.com') RETURNING id", Long.class);
    }

    @Test
    void accessoryStockLimitsAssignmentsAndBlocksDeletion() throws Exception {
        JsonNode accessory = postJson("/api/accessories",
                Map.of("name", "usb-c dock", "categoryId", 4, "quantity", 1, "minQuantity", 1), 201);
        long accessoryId = accessory.path("id").asLong();
        assertThat(accessory.path("name").asText()).isEqualTo("USB-C DOCK");
        assertThat(accessory.path("availableQuantity").asInt()).isEqualTo(1);

        JsonNode assigned = postJson("/api/accessories/" + accessoryId + "/assignments",
                Map.of("userId", minaId, "note", "desk 4"), 201);
        assertThat(assigned.path("availableQuantity").asInt()).isZero();
        assertThat(assigned.path("belowMinimum").asBoolean()).isTrue();
        assertThat(assigned.path("assignments").get(0).path("userLabel").asText()).isEqualTo("Mina Park");
        long assignmentId = assigned.path("assignments").get(0).path("id").asLong();

        mockMvc.perform(post("/api/accessories/" + accessoryId + "/assignments")
                        .header(ACTOR_HEADER, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("userId", joonId))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NO_AVAILABLE_QUANTITY"));

        mockMvc.perform(delete("/api/accessories/" + accessoryId).header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ACCESSORY_HAS_ASSIGNMENTS"));

        JsonNode released = postJson("/api/accessories/" + accessoryId + "/assignments/" + assignmentId + "/release", Map.of(), 200);
        assertThat(released.path("availableQuantity").asInt()).isEqualTo(1);
        assertThat(released.path("assignments")).isEmpty();

        mockMvc.perform(delete("/api/accessories/" + accessoryId).header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isNoContent());
        Integer activeAccessories = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM accessories WHERE deleted_at IS NULL", Integer.class);
        assertThat(activeAccessories).isZero();
    }

    @Test
    void copiedLicenseGetsItsOwnFreeSeatPool() throws Exception {
        JsonNode source = postJson("/api/licenses",
                Map.of("name", "Office Suite", "serial", "SN-1", "seats", 2, "reassignable", true), 201);
        long sourceId = source.path("id").asLong();
        postJson("/api/licenses/" + sourceId + "/seats/assign", Map.of("kind", "USER", "userId", minaId), 200);

        JsonNode copy = postJson("/api/licenses/" + sourceId + "/copy", Map.of(), 201);

        assertThat(copy.path("id").asLong()).isNotEqualTo(sourceId);
        assertThat(copy.path("name").asText()).isEqualTo("Office Suite");
        assertThat(copy.path("serial").isNull()).isTrue();
        assertThat(copy.path("availableSeats").asInt()).isEqualTo(2);
        assertThat(copy.path("seatDetails")).hasSize(2);
    }

    @Test
    void checkedOutAssetCannotBeDeleted() throws Exception {
        JsonNode asset = postJson("/api/assets", Map.of("tag", "LAP-001", "name", "ThinkPad X1"), 201);
        long assetId = asset.path("id").asLong();
        postJson("/api/assets/" + assetId + "/checkout", Map.of("kind", "USER", "userId", minaId), 200);

        mockMvc.perform(delete("/api/assets/" + assetId).header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ASSET_IN_USE"));

        JsonNode copy = postJson("/api/assets/" + assetId + "/copy", Map.of("tag", "lap-002"), 201);
        assertThat(copy.path("tag").asText()).isEqualTo("LAP-002");
        assertThat(copy.path("name").asText()).isEqualTo("ThinkPad X1");
        assertThat(copy.path("assignedType").isNull()).isTrue();
    }

    private JsonNode postJson(String path, Object body, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .header(ACTOR_HEADER, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().is(expectedStatus))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
