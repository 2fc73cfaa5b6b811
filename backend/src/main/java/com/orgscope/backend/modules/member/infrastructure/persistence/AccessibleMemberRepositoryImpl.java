package com.orgscope.backend.modules.member.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.orgscope.backend.modules.member.domain.OrgMember;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class AccessibleMemberRepositoryImpl implements AccessibleMemberRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<OrgMember> searchAccessibleMembers(AccessibleMemberSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");

        boolean hasPaths = !condition.accessiblePaths().isEmpty();
        if (!hasPaths && condition.selfId() == null) {
            return new PageImpl<>(List.of(), pageable, 0);
        }

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        List<String> reach = new ArrayList<>();
        if (hasPaths) {
            reach.add("(n.is_active = TRUE AND n.path IN (:paths))");
            params.put("paths", List.copyOf(condition.accessiblePaths()));
        }
        if (condition.selfId() != null) {
            reach.add("m.id = :selfId");
            params.put("selfId", condition.selfId());
        }
        whereClauses.add("(" + String.join(" OR ", reach) + ")");

        if (condition.excludeId() != null) {
            whereClauses.add("m.id <> :excludeId");
            params.put("excludeId", condition.excludeId());
        }

        if (StringUtils.hasText(condition.keyword())) {
            whereClauses.add("(LOWER(m.full_name) LIKE :keyword OR LOWER(m.email) LIKE :keyword)");
            params.put("keyword", "%" + condition.keyword().trim().toLowerCase(Locale.ROOT) + "%");
        }

        if (condition.active() != null) {
            whereClauses.add("m.is_active = :active");
            params.put("active", condition.active());
        }

        if (condition.createdAfter() != null) {
            whereClauses.add("m.created_at >= :createdAfter");
            params.put("createdAfter", condition.createdAfter());
        }
        if (condition.createdBefore() != null) {
            whereClauses.add("m.created_at <= :createdBefore");
            params.put("createdBefore", condition.createdBefore());
        }
        if (condition.lastLoginAfter() != null) {
            whereClauses.add("m.last_login_at >= :lastLoginAfter");
            params.put("lastLoginAfter", condition.lastLoginAfter());
        }
        if (condition.lastLoginBefore() != null) {
            whereClauses.add("m.last_login_at <= :lastLoginBefore");
            params.put("lastLoginBefore", condition.lastLoginBefore());
        }

        if (!condition.levels().isEmpty()) {
            whereClauses.add("n.level IN (:levels)");
            params.put("levels", List.copyOf(condition.levels()));
        }

        String baseJoin = " FROM org_member m "
                + " LEFT JOIN org_node n ON n.id = m.base_node_id ";
        String whereSql = " WHERE " + String.join(" AND ", whereClauses);

        Query countQuery = entityManager.createNativeQuery("SELECT COUNT(*)" + baseJoin + whereSql);
        applyParameters(countQuery, params);
        Number total = (Number) countQuery.getSingleResult();

        String direction = condition.ascending() ? "ASC" : "DESC";
        String orderBy = " ORDER BY " + condition.sortField().column() + " " + direction + " NULLS LAST, m.id";
        String dataSql = "SELECT m.id" + baseJoin + whereSql + orderBy + " LIMIT :limit OFFSET :offset";

        Query dataQuery = entityManager.createNativeQuery(dataSql);
        applyParameters(dataQuery, params);
        dataQuery.setParameter("limit", pageable.getPageSize());
        dataQuery.setParameter("offset", (long) pageable.getPageNumber() * pageable.getPageSize());

        @SuppressWarnings("unchecked")
        List<Object> rawIds = dataQuery.getResultList();
        List<UUID> ids = rawIds.stream()
                .map(value -> value instanceof UUID uuid ? uuid : UUID.fromString(value.toString()))
                .toList();

        if (ids.isEmpty()) {
            return new PageImpl<>(List.of(), pageable, total.longValue());
        }

        List<OrgMember> members = new ArrayList<>(entityManager.createQuery("""
                        select m
                          from OrgMember m
                          left join fetch m.baseNode
                         where m.id in :ids
                        """, OrgMember.class)
                .setParameter("ids", ids)
                .getResultList());

        Map<UUID, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            index.put(ids.get(i), i);
        }
        members.sort((a, b) -> Integer.compare(index.getOrDefault(a.getId(), Integer.MAX_VALUE),
                index.getOrDefault(b.getId(), Integer.MAX_VALUE)));

        return new PageImpl<>(members, pageable, total.longValue());
    }

    private static void applyParameters(Query query, Map<String, Object> params) {
        params.forEach(query::setParameter);
    }
}
