package com.orgscope.backend.modules.query.application;

import com.orgscope.backend.modules.access.domain.AccessDecision;
import com.orgscope.backend.modules.member.domain.OrgMember;

public record AccessibleMember(OrgMember member, AccessDecision access) {
}
