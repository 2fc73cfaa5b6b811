package com.orgscope.backend.global.security;

import java.util.UUID;

public record ActorPrincipal(UUID actorId) {
}
