package com.orgscope.backend.modules.hierarchy.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Descendant patterns passed to this repository come from
 * {@link com.orgscope.backend.modules.hierarchy.domain.MaterializedPath#descendantPattern(String)}.
 */
public interface HierarchyNodeRepository extends JpaRepository<HierarchyNode, UUID> {

    Optional<HierarchyNode> findByIdAndActiveTrue(UUID id);

    Optional<HierarchyNode> findByPathAndActiveTrue(String path);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select n from HierarchyNode n where n.id = :id")
    Optional<HierarchyNode> findByIdForUpdate(@Param("id") UUID id);

    List<HierarchyNode> findByParentIdAndActiveTrueOrderBySortOrderAscNameAsc(UUID parentId);

    List<HierarchyNode> findByParentIdIsNullAndActiveTrueOrderBySortOrderAscNameAsc();

    boolean existsByParentIdAndCodeAndActiveTrue(UUID parentId, String code);

    boolean existsByParentIdIsNullAndCodeAndActiveTrue(String code);

    boolean existsByParentIdAndActiveTrue(UUID parentId);

    List<HierarchyNode> findByActiveTrue();

    @Query("""
            select n from HierarchyNode n
            where n.active = true
              and n.path like :pattern escape '!'
            order by n.level asc, n.sortOrder asc, n.name asc
            """)
    List<HierarchyNode> findActiveDescendants(@Param("pattern") String descendantPattern);

    @Query("""
            select n.path from HierarchyNode n
            where n.active = true
              and n.path like :pattern escape '!'
            """)
    List<String> findActiveDescendantPaths(@Param("pattern") String descendantPattern);

    @Query("""
            select n from HierarchyNode n
            where n.active = true
              and n.path in :paths
            order by n.level asc
            """)
    List<HierarchyNode> findActiveByPathIn(@Param("paths") Collection<String> paths);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select n from HierarchyNode n
            where n.active = true
              and n.path like :pattern escape '!'
            order by n.id
            """)
    List<HierarchyNode> lockActiveDescendants(@Param("pattern") String descendantPattern);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update HierarchyNode n
               set n.path = concat(:newPath, substring(n.path, :cutFrom)),
                   n.level = n.level + :levelDelta,
                   n.updatedAt = :now
             where n.active = true
               and n.path like :pattern escape '!'
            """)
    int rebaseActiveDescendants(
            @Param("pattern") String oldDescendantPattern,
            @Param("cutFrom") int cutFrom,
            @Param("newPath") String newPath,
            @Param("levelDelta") int levelDelta,
            @Param("now") OffsetDateTime now
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update HierarchyNode n
               set n.active = false,
                   n.updatedAt = :now
             where n.active = true
               and (n.id = :id or n.path like :pattern escape '!')
            """)
    int softDeleteSubtree(
            @Param("id") UUID id,
            @Param("pattern") String descendantPattern,
            @Param("now") OffsetDateTime now
    );
}
