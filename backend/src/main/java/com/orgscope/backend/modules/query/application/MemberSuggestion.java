package com.orgscope.backend.modules.query.application;

import java.util.UUID;

public record MemberSuggestion(UUID id, String fullName, String email, String nodeName) {
}
