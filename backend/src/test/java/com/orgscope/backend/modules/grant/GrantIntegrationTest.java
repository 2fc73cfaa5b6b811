package com.orgscope.backend.modules.grant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.orgscope.backend.global.security.ActorPrincipal;
import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
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
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

@SpringBootTest
@AutoConfigureMockMvc
class GrantIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestFixtures fixtures;

    private HierarchyNode org;
    private HierarchyNode eng;
    private OrgMember manager;
    private OrgMember carol;

    @BeforeEach
    void setUp() {
        org = fixtures.root("org");
        eng = fixtures.child(org, "eng");
        manager = fixtures.member("manager@example.com", "Manager", org);
        carol = fixtures.member("carol@example.com", "Carol", eng);
        fixtures.grant(manager, org, GrantRole.MANAGER, true);
    }

    @Test
    void managerCannotHandOutAdmin() throws Exception {
        mockMvc.perform(post("/grants")
                        .header(ACTOR_HEADER, manager.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(grantBody(carol.getId(), eng.getId(), "ADMIN")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("PRIVILEGE_ESCALATION"))
                .andExpect(jsonPath("$.kind").value("BUSINESS_RULE"));

        mockMvc.perform(get("/access/can-grant")
                        .param("nodeId", eng.getId().toString())
                        .param("role", "ADMIN")
                        .header(ACTOR_HEADER, manager.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(false));
    }

    @Test
    void grantAuditAndDuplicate() throws Exception {
        UUID grantId = createGrant(manager.getId(), carol.getId(), eng.getId(), "MANAGER");

        mockMvc.perform(post("/grants")
                        .header(ACTOR_HEADER, manager.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(grantBody(carol.getId(), eng.getId(), "READ")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_GRANT"));

        Integer audits = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM audit_log WHERE action_type = 'GRANT_CREATED' AND resource_key = ?",
                Integer.class, grantId.toString());
        assertThat(audits).isEqualTo(1);
    }

    @Test
    void holderCanRevokeOwnGrant() throws Exception {
        UUID grantId = createGrant(manager.getId(), carol.getId(), eng.getId(), "READ");

        mockMvc.perform(delete("/grants/{id}", grantId)
                        .param("reason", "moving teams")
                        .header(ACTOR_HEADER, carol.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false))
                .andExpect(jsonPath("$.revokedBy").value(carol.getId().toString()));

        mockMvc.perform(delete("/grants/{id}", grantId).header(ACTOR_HEADER, manager.getId()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("GRANT_ALREADY_INACTIVE"));

        mockMvc.perform(get("/grants")
                        .param("actorId", carol.getId().toString())
                        .param("includeExpired", "true")
                        .header(ACTOR_HEADER, manager.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void revokingRemovesOnlyPathsNoOtherGrantReaches() throws Exception {
        HierarchyNode backend = fixtures.child(eng, "backend");
        HierarchyNode sales = fixtures.child(org, "sales");
        UUID engGrant = createGrant(manager.getId(), carol.getId(), eng.getId(), "READ");
        createGrantBody(manager.getId(), """
                {"actorId":"%s","nodeId":"%s","role":"READ","inheritToDescendants":false}
                """.formatted(carol.getId(), backend.getId()));
        createGrantBody(manager.getId(), """
                {"actorId":"%s","nodeId":"%s","role":"READ","inheritToDescendants":false}
                """.formatted(carol.getId(), sales.getId()));

        mockMvc.perform(get("/access/scope").header(ACTOR_HEADER, carol.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessiblePaths", contains("org.eng", "org.eng.backend", "org.sales")));

        mockMvc.perform(delete("/grants/{id}", engGrant).header(ACTOR_HEADER, carol.getId()))
                .andExpect(status().isOk());

        mockMvc.perform(get("/access/scope").header(ACTOR_HEADER, carol.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessiblePaths", contains("org.eng.backend", "org.sales")));
    }

    @Test
    void outsiderCannotListAnotherMembersGrants() throws Exception {
        HierarchyNode other = fixtures.root("other");
        OrgMember outsider = fixtures.member("outsider@example.com", "Outsider", other);
        createGrant(manager.getId(), carol.getId(), eng.getId(), "READ");

        mockMvc.perform(get("/grants")
                        .param("actorId", carol.getId().toString())
                        .param("includeExpired", "true")
                        .with(asActor(outsider)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PRIVILEGES"));

        mockMvc.perform(get("/grants")
                        .param("nodeId", eng.getId().toString())
                        .with(asActor(outsider)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PRIVILEGES"));
    }

    @Test
    void grantListingFollowsScope() throws Exception {
        createGrant(manager.getId(), carol.getId(), eng.getId(), "READ");

        mockMvc.perform(get("/grants")
                        .param("actorId", carol.getId().toString())
                        .with(asActor(carol)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(get("/grants")
                        .param("nodeId", eng.getId().toString())
                        .with(asActor(carol)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/grants")
                        .param("nodeId", eng.getId().toString())
                        .with(asActor(manager)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].actorId").value(carol.getId().toString()));
    }

    @Test
    void outsiderCannotRevoke() throws Exception {
        HierarchyNode other = fixtures.root("other");
        OrgMember outsider = fixtures.member("outsider@example.com", "Outsider", other);
        UUID grantId = createGrant(manager.getId(), carol.getId(), eng.getId(), "READ");

        mockMvc.perform(delete("/grants/{id}", grantId).header(ACTOR_HEADER, outsider.getId()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PRIVILEGES"));
    }

    @Test
    void expiredGrantDropsOutOfScope() throws Exception {
        fixtures.grant(carol, eng, GrantRole.READ, true, OffsetDateTime.now(ZoneOffset.UTC).plusHours(1));
        jdbcTemplate.update("UPDATE access_grant SET valid_until = now() - interval '1 minute' WHERE actor_id = ?",
                carol.getId());

        mockMvc.perform(get("/access/scope").header(ACTOR_HEADER, carol.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessiblePaths").isEmpty());
    }

    @Test
    void pastExpiryIsRejected() throws Exception {
        mockMvc.perform(post("/grants")
                        .header(ACTOR_HEADER, manager.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"actorId":"%s","nodeId":"%s","role":"READ","validUntil":"2000-01-01T00:00:00Z"}
                                """.formatted(carol.getId(), eng.getId())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_EXPIRY"));
    }

    @Test
    void updateChangesRoleWithinAuthority() throws Exception {
        UUID grantId = createGrant(manager.getId(), carol.getId(), eng.getId(), "READ");

        mockMvc.perform(patch("/grants/{id}", grantId)
                        .header(ACTOR_HEADER, manager.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role":"MANAGER","inheritToDescendants":false}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("MANAGER"))
                .andExpect(jsonPath("$.inheritToDescendants").value(false));
    }

    @Test
    void registerMemberRequiresManagerAndUniqueEmail() throws Exception {
        mockMvc.perform(post("/members")
                        .header(ACTOR_HEADER, manager.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"dave@example.com","fullName":"Dave","baseNodeId":"%s"}
                                """.formatted(eng.getId())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.basePath").value("org.eng"));

        mockMvc.perform(post("/members")
                        .header(ACTOR_HEADER, manager.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"DAVE@example.com","fullName":"Dave Again","baseNodeId":"%s"}
                                """.formatted(eng.getId())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_TAKEN"));

        mockMvc.perform(post("/members")
                        .header(ACTOR_HEADER, carol.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"erin@example.com","fullName":"Erin","baseNodeId":"%s"}
                                """.formatted(eng.getId())))
                .andExpect(status().isForbidden());
    }

    private UUID createGrant(UUID granterId, UUID actorId, UUID nodeId, String role) throws Exception {
        MvcResult result = mockMvc.perform(post("/grants")
                        .header(ACTOR_HEADER, granterId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(grantBody(actorId, nodeId, role)))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.path("id").asText());
    }

    private void createGrantBody(UUID granterId, String body) throws Exception {
        mockMvc.perform(post("/grants")
                        .header(ACTOR_HEADER, granterId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated());
    }

    private static RequestPostProcessor asActor(OrgMember member) {
        return authentication(new UsernamePasswordAuthenticationToken(
                new ActorPrincipal(member.getId()), null, List.of(new SimpleGrantedAuthority("ROLE_ACTOR"))));
    }

    private static String grantBody(UUID actorId, UUID nodeId, String role) {
        return """
                {"actorId":"%s","nodeId":"%s","role":"%s"}
                """.formatted(actorId, nodeId, role);
    }
}
