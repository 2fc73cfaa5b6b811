package com.orgscope.backend.modules.grant.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.orgscope.backend.modules.grant.domain.AccessGrant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccessGrantRepository extends JpaRepository<AccessGrant, UUID> {

    boolean existsByActor_IdAndNode_IdAndActiveTrue(UUID actorId, UUID nodeId);

    @Query("""
            select g from AccessGrant g
            join fetch g.node
            where g.actor.id = :actorId
            order by g.nodePath asc, g.createdAt asc
            """)
    List<AccessGrant> findAllByActorId(@Param("actorId") UUID actorId);

    @Query("""
            select g from AccessGrant g
            join fetch g.node
            where g.actor.id = :actorId
              and g.active = true
              and g.validFrom <= :now
              and (g.validUntil is null or g.validUntil > :now)
            order by g.nodePath asc
            """)
    List<AccessGrant> findEffectiveByActorId(@Param("actorId") UUID actorId, @Param("now") OffsetDateTime now);

    @Query("""
            select g from AccessGrant g
            join fetch g.node n
            where g.actor.id = :actorId
              and g.active = true
              and n.active = true
              and g.validFrom <= :now
              and (g.validUntil is null or g.validUntil > :now)
            order by g.nodePath asc
            """)
    List<AccessGrant> findEffectiveOnActiveNodesByActorId(@Param("actorId") UUID actorId, @Param("now") OffsetDateTime now);

    @Query("""
            select g from AccessGrant g
            join fetch g.actor
            where g.node.id = :nodeId
              and g.active = true
            order by g.createdAt asc
            """)
    List<AccessGrant> findActiveByNodeId(@Param("nodeId") UUID nodeId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update AccessGrant g
               set g.nodePath = concat(:newPath, substring(g.nodePath, :cutFrom)),
                   g.updatedAt = :now
             where g.node.id in :nodeIds
            """)
    int rebaseNodePaths(
            @Param("nodeIds") Collection<UUID> nodeIds,
            @Param("cutFrom") int cutFrom,
            @Param("newPath") String newPath,
            @Param("now") OffsetDateTime now
    );

    @Query("""
            select g from AccessGrant g
            where g.actor.id in :actorIds
              and g.active = true
              and g.validFrom <= :now
              and (g.validUntil is null or g.validUntil > :now)
            """)
    List<AccessGrant> findEffectiveByActorIdIn(@Param("actorIds") Collection<UUID> actorIds, @Param("now") OffsetDateTime now);
}
