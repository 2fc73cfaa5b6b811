package com.orgscope.backend.modules.grant.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.orgscope.backend.global.jpa.AbstractTimestampedEntity;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.member.domain.OrgMember;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;
import org.springframework.data.annotation.LastModifiedBy;

/**
 * A role given to one member at one node. {@code nodePath} mirrors the node's current path
 * and is rewritten whenever the node's subtree moves.
 */
@Entity
@Table(name = "access_grant")
public class AccessGrant extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "actor_id", nullable = false, updatable = false)
    private OrgMember actor;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "node_id", nullable = false, updatable = false)
    private HierarchyNode node;

    @Column(name = "node_path", nullable = false)
    private String nodePath;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private GrantRole role;

    @Column(name = "inherit_to_descendants", nullable = false)
    private boolean inheritToDescendants = true;

    @Column(name = "valid_from", nullable = false)
    private OffsetDateTime validFrom;

    @Column(name = "valid_until")
    private OffsetDateTime validUntil;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "granted_by", updatable = false)
    private UUID grantedBy;

    @Column(name = "revoked_by")
    private UUID revokedBy;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @LastModifiedBy
    @Column(name = "updated_by")
    private UUID updatedBy;

    public UUID getId() {
        return id;
    }

    public OrgMember getActor() {
        return actor;
    }

    public void setActor(OrgMember actor) {
        this.actor = actor;
    }

    public HierarchyNode getNode() {
        return node;
    }

    public void setNode(HierarchyNode node) {
        this.node = node;
        this.nodePath = node != null ? node.getPath() : null;
    }

    public String getNodePath() {
        return nodePath;
    }

    public GrantRole getRole() {
        return role;
    }

    public void setRole(GrantRole role) {
        this.role = role;
    }

    public boolean isInheritToDescendants() {
        return inheritToDescendants;
    }

    public void setInheritToDescendants(boolean inheritToDescendants) {
        this.inheritToDescendants = inheritToDescendants;
    }

    public OffsetDateTime getValidFrom() {
        return validFrom;
    }

    public void setValidFrom(OffsetDateTime validFrom) {
        this.validFrom = validFrom;
    }

    public OffsetDateTime getValidUntil() {
        return validUntil;
    }

    public void setValidUntil(OffsetDateTime validUntil) {
        this.validUntil = validUntil;
    }

    public boolean isActive() {
        return active;
    }

    public UUID getGrantedBy() {
        return grantedBy;
    }

    public void setGrantedBy(UUID grantedBy) {
        this.grantedBy = grantedBy;
    }

    public UUID getRevokedBy() {
        return revokedBy;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public UUID getUpdatedBy() {
        return updatedBy;
    }

    public boolean isEffectiveAt(OffsetDateTime now) {
        return active
                && (validFrom == null || !validFrom.isAfter(now))
                && (validUntil == null || validUntil.isAfter(now));
    }

    public void revoke(UUID revokedBy, OffsetDateTime now) {
        this.active = false;
        this.revokedBy = revokedBy;
        this.revokedAt = now;
    }
}
