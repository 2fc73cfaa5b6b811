package com.orgscope.backend.modules.audit.application;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.orgscope.backend.global.web.RequestIdFilter;
import com.orgscope.backend.modules.audit.domain.AuditLog;
import com.orgscope.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists structured audit events. Runs inside the caller's transaction so an event is only kept
 * when the change it describes commits.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogRepository;

    public AuditLogService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorId(command.actorId());
        auditLog.setCorrelationId(command.correlationId() != null
                ? command.correlationId()
                : RequestIdFilter.currentRequestId());

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
        log.info("audit action={} resource={}:{} actor={} detail={}",
                command.actionType(), command.resourceType(), command.resourceKey(), command.actorId(), command.detail());
    }

    public void record(String actionType, String resourceType, UUID resourceId, UUID actorId, Map<String, Object> detail) {
        record(new AuditLogCommand(actionType, resourceType, resourceId.toString(), actorId, null, detail));
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorId,
            String correlationId,
            Map<String, Object> detail
    ) {
    }
}
