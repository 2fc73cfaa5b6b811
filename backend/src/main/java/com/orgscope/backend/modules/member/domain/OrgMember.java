package com.orgscope.backend.modules.member.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.orgscope.backend.global.jpa.AbstractTimestampedEntity;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A person placed in the org chart. Members are both the actors that hold grants and the
 * entities whose visibility those grants decide.
 */
@Entity
@Table(name = "org_member")
public class OrgMember extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "full_name", nullable = false)
    private String fullName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "base_node_id")
    private HierarchyNode baseNode;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "system_operator", nullable = false)
    private boolean systemOperator;

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public HierarchyNode getBaseNode() {
        return baseNode;
    }

    public void setBaseNode(HierarchyNode baseNode) {
        this.baseNode = baseNode;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isSystemOperator() {
        return systemOperator;
    }

    public void setSystemOperator(boolean systemOperator) {
        this.systemOperator = systemOperator;
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public void setLastLoginAt(OffsetDateTime lastLoginAt) {
        this.lastLoginAt = lastLoginAt;
    }
}
