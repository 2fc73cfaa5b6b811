package com.orgscope.backend.modules.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.orgscope.backend.modules.member.domain.OrgMember;
import com.orgscope.backend.support.AbstractPostgresIntegrationTest;
import com.orgscope.backend.support.TestFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Drives a small organization through the HTTP API: build a tree, hand out a grant, move and delete
 * subtrees, and watch the grantee's scope follow.
 */
@SpringBootTest
@AutoConfigureMockMvc
class AccessScopeIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestFixtures fixtures;

    private OrgMember operator;
    private UUID orgId;
    private UUID engId;
    private UUID backendId;
    private UUID salesId;
    private UUID holdingId;

    @BeforeEach
    void setUp() throws Exception {
        operator = fixtures.operator("ops@example.com");
        orgId = createNode("Org", "org", null);
        engId = createNode("Engineering", "eng", orgId);
        backendId = createNode("Backend", "backend", engId);
        salesId = createNode("Sales", "sales", orgId);
        holdingId = createNode("Holding", "holding", null);
    }

    @Test
    void adminGrantFollowsMovedSubtree() throws Exception {
        OrgMember alice = fixtures.member("alice@example.com", "Alice", fixtures.reload(engId));
        grant(alice.getId(), engId, "ADMIN");

        assertThat(accessiblePaths(alice.getId())).containsExactly("org.eng", "org.eng.backend");

        mockMvc.perform(post("/hierarchy/nodes/{id}/move", engId)
                        .header(ACTOR_HEADER, operator.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"newParentId":"%s"}
                                """.formatted(holdingId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path").value("holding.eng"))
                .andExpect(jsonPath("$.level").value(1));

        assertThat(accessiblePaths(alice.getId())).containsExactly("holding.eng", "holding.eng.backend");
        assertThat(jdbcTemplate.queryForObject("SELECT path FROM org_node WHERE id = ?", String.class, backendId))
                .isEqualTo("holding.eng.backend");
        assertThat(jdbcTemplate.queryForObject("SELECT level FROM org_node WHERE id = ?", Integer.class, backendId))
                .isEqualTo(2);

        mockMvc.perform(get("/grants/mine").header(ACTOR_HEADER, alice.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].nodePath").value("holding.eng"))
                .andExpect(jsonPath("$[0].role").value("ADMIN"));

        mockMvc.perform(get("/access/check/nodes/{id}", backendId).header(ACTOR_HEADER, alice.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canAccess").value(true))
                .andExpect(jsonPath("$.accessLevel").value("INHERITED"))
                .andExpect(jsonPath("$.effectiveRole").value("ADMIN"));

        mockMvc.perform(get("/access/check/nodes/{id}", salesId).header(ACTOR_HEADER, alice.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canAccess").value(false));
    }

    @Test
    void moveUnderOwnDescendantIsRejected() throws Exception {
        mockMvc.perform(post("/hierarchy/nodes/{id}/move", engId)
                        .header(ACTOR_HEADER, operator.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"newParentId":"%s"}
                                """.formatted(backendId)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("CIRCULAR_MOVE"));

        assertThat(jdbcTemplate.queryForObject("SELECT path FROM org_node WHERE id = ?", String.class, backendId))
                .isEqualTo("org.eng.backend");
    }

    @Test
    void forceDeleteRemovesSubtreeFromScope() throws Exception {
        OrgMember alice = fixtures.member("alice@example.com", "Alice", fixtures.reload(orgId));
        grant(alice.getId(), engId, "READ");

        mockMvc.perform(delete("/hierarchy/nodes/{id}", engId).header(ACTOR_HEADER, operator.getId()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("NODE_HAS_DEPENDENTS"));

        mockMvc.perform(delete("/hierarchy/nodes/{id}", engId)
                        .param("force", "true")
                        .header(ACTOR_HEADER, operator.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deactivatedCount").value(2));

        assertThat(accessiblePaths(alice.getId())).isEmpty();
        mockMvc.perform(get("/hierarchy/nodes/{id}", backendId).header(ACTOR_HEADER, operator.getId()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NODE_NOT_FOUND"));

        // the code is free again under the same parent
        createNode("Engineering", "eng", orgId);
    }

    @Test
    void memberWithoutGrantsCannotMutate() throws Exception {
        OrgMember bob = fixtures.member("bob@example.com", "Bob", fixtures.reload(salesId));

        mockMvc.perform(post("/hierarchy/nodes")
                        .header(ACTOR_HEADER, bob.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Field","code":"field","parentId":"%s"}
                                """.formatted(salesId)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PRIVILEGES"));

        mockMvc.perform(get("/access/scope").header(ACTOR_HEADER, bob.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessiblePaths").isEmpty())
                .andExpect(jsonPath("$.accessibleMemberCount").value(0));
    }

    @Test
    void requestsWithoutActorAreUnauthenticated() throws Exception {
        mockMvc.perform(get("/access/scope"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/access/scope").header(ACTOR_HEADER, "not-a-uuid"))
                .andExpect(status().isUnauthorized());
    }

    private UUID createNode(String name, String code, UUID parentId) throws Exception {
        String parent = parentId != null ? "\"%s\"".formatted(parentId) : "null";
        MvcResult result = mockMvc.perform(post("/hierarchy/nodes")
                        .header(ACTOR_HEADER, operator.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"%s","code":"%s","parentId":%s}
                                """.formatted(name, code, parent)))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.path("id").asText());
    }

    private void grant(UUID actorId, UUID nodeId, String role) throws Exception {
        mockMvc.perform(post("/grants")
                        .header(ACTOR_HEADER, operator.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"actorId":"%s","nodeId":"%s","role":"%s","inheritToDescendants":true}
                                """.formatted(actorId, nodeId, role)))
                .andExpect(status().isCreated());
    }

    private List<String> accessiblePaths(UUID actorId) throws Exception {
        MvcResult result = mockMvc.perform(get("/access/scope").header(ACTOR_HEADER, actorId))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode paths = objectMapper.readTree(result.getResponse().getContentAsString()).path("accessiblePaths");
        List<String> values = new ArrayList<>();
        paths.forEach(path -> values.add(path.asText()));
        return values;
    }
}
