package com.orgscope.backend.modules.member.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.orgscope.backend.modules.member.domain.OrgMember;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrgMemberRepository extends JpaRepository<OrgMember, UUID>, AccessibleMemberRepositoryCustom {

    Optional<OrgMember> findByIdAndActiveTrue(UUID id);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCaseAndIdNot(String email, UUID id);

    @Query("""
            select m from OrgMember m
            left join fetch m.baseNode
            where m.id = :id
            """)
    Optional<OrgMember> findWithBaseNodeById(@Param("id") UUID id);

    @Query("""
            select count(m) from OrgMember m
            join m.baseNode n
            where m.active = true
              and n.active = true
              and n.id = :nodeId
            """)
    long countActiveByBaseNodeId(@Param("nodeId") UUID nodeId);

    @Query("""
            select count(m) from OrgMember m
            join m.baseNode n
            where m.active = true
              and n.active = true
              and n.path in :paths
            """)
    long countActiveByBaseNodePathIn(@Param("paths") Collection<String> paths);

    @Query("""
            select m from OrgMember m
            left join fetch m.baseNode
            where m.id in :ids
            """)
    List<OrgMember> findAllWithBaseNodeByIdIn(@Param("ids") Collection<UUID> ids);

    /**
     * Active and inactive members placed on active nodes at {@code paths}.
     */
    @Query("""
            select m from OrgMember m
            join fetch m.baseNode n
            where n.active = true
              and n.path in :paths
            order by n.path asc, m.fullName asc
            """)
    List<OrgMember> findAllByActiveBaseNodePathIn(@Param("paths") Collection<String> paths);
}
