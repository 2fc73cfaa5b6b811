package com.orgscope.backend.modules.member;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.orgscope.backend.modules.grant.domain.GrantRole;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.member.domain.OrgMember;
import com.orgscope.backend.support.AbstractPostgresIntegrationTest;
import com.orgscope.backend.support.TestFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class MemberIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestFixtures fixtures;

    private OrgMember manager;
    private OrgMember carol;
    private OrgMember outsider;

    @BeforeEach
    void setUp() {
        HierarchyNode org = fixtures.root("org");
        HierarchyNode eng = fixtures.child(org, "eng");
        manager = fixtures.member("manager@example.com", "Manager", org);
        carol = fixtures.member("carol@example.com", "Carol", eng);
        outsider = fixtures.member("outsider@example.com", "Outsider", fixtures.root("other"));
        fixtures.grant(manager, org, GrantRole.MANAGER, true);
    }

    @Test
    void memberEditsOwnRecordButNotOthers() throws Exception {
        mockMvc.perform(patch("/members/{id}", carol.getId())
                        .header(ACTOR_HEADER, carol.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"fullName":"Carol Kim"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fullName").value("Carol Kim"));

        mockMvc.perform(patch("/members/{id}", carol.getId())
                        .header(ACTOR_HEADER, outsider.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"fullName":"Someone Else"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PRIVILEGES"));

        mockMvc.perform(patch("/members/{id}", carol.getId())
                        .header(ACTOR_HEADER, manager.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"Manager@Example.com"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_TAKEN"));
    }

    @Test
    void deactivatedMemberCanBeReactivatedOnce() throws Exception {
        mockMvc.perform(delete("/members/{id}", carol.getId()).header(ACTOR_HEADER, manager.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(post("/members/{id}/reactivate", carol.getId()).header(ACTOR_HEADER, outsider.getId()))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/members/{id}/reactivate", carol.getId()).header(ACTOR_HEADER, manager.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.basePath").value("org.eng"));

        mockMvc.perform(post("/members/{id}/reactivate", carol.getId()).header(ACTOR_HEADER, manager.getId()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("MEMBER_ALREADY_ACTIVE"));

        Integer audits = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM audit_log WHERE action_type = 'MEMBER_REACTIVATED' AND resource_key = ?",
                Integer.class, carol.getId().toString());
        assertThat(audits).isEqualTo(1);
    }
}
