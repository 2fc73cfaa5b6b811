package com.orgscope.backend.modules.query.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.orgscope.backend.modules.grant.domain.GrantRole;

/**
 * Member counts over the part of the actor's scope a statistics request targets.
 *
 * @param byRole effective grants held by the counted members, per role
 */
public record MemberStatistics(
        long totalMembers,
        long activeMembers,
        long inactiveMembers,
        List<NodeCount> byNode,
        Map<GrantRole, Long> byRole,
        long newMembersLast30Days,
        long loginsLast30Days,
        int nodesAnalyzed
) {

    public MemberStatistics {
        byNode = List.copyOf(byNode);
        byRole = Map.copyOf(byRole);
    }

    /**
     * @param percentageOfTotal share of all counted members, rounded to two decimals
     */
    public record NodeCount(
            UUID nodeId,
            String nodeName,
            String nodePath,
            long memberCount,
            long activeCount,
            double percentageOfTotal
    ) {
    }
}
