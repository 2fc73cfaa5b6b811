package com.orgscope.backend.modules.member.infrastructure.persistence;

import com.orgscope.backend.modules.member.domain.OrgMember;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface AccessibleMemberRepositoryCustom {

    Page<OrgMember> searchAccessibleMembers(AccessibleMemberSearchCondition condition, Pageable pageable);
}
