package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.AuditLog;
import com.cred.freestyle.commerce.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Instant;

/**
 * Audit collaborator. Records administrative changes with JSON
 * snapshots of the affected row before and after the change.
 *
 * Entries join the caller's transaction, so a rolled-back change leaves
 * no audit trail either.
 *
 * @author Commerce Platform Team
 */
@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private static final int USER_AGENT_MAX_LENGTH = 500;

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public AuditService(AuditLogRepository auditLogRepository, ObjectMapper objectMapper) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Serialize an entity to JSON for an audit snapshot.
     * Take the snapshot before mutating the entity.
     *
     * @param value Entity or value object, may be null
     * @return JSON text, or null for a null value
     */
    public String snapshot(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize audit snapshot of " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Record an administrative change.
     *
     * @param adminId Acting admin
     * @param action Action performed
     * @param tableName Affected table
     * @param recordId Affected row
     * @param oldValues JSON snapshot before the change (null on create)
     * @param newValues Value after the change (null on delete)
     * @return Saved audit entry
     */
    @Transactional(propagation = Propagation.REQUIRED)
    public AuditLog record(String adminId, AuditAction action, String tableName, String recordId,
                           String oldValues, Object newValues) {
        AuditLog.AuditLogBuilder entry = AuditLog.builder()
                .adminId(adminId)
                .action(action.name())
                .tableName(tableName)
                .recordId(recordId)
                .oldValues(oldValues)
                .newValues(snapshot(newValues))
                .createdAt(Instant.now());

        HttpServletRequest request = currentRequest();
        if (request != null) {
            entry.ipAddress(request.getRemoteAddr());
            String userAgent = request.getHeader("User-Agent");
            if (userAgent != null && userAgent.length() > USER_AGENT_MAX_LENGTH) {
                userAgent = userAgent.substring(0, USER_AGENT_MAX_LENGTH);
            }
            entry.userAgent(userAgent);
        }

        AuditLog saved = auditLogRepository.save(entry.build());
        logger.info("Audit: admin {} {} {} {}", adminId, action, tableName, recordId);
        return saved;
    }

    /**
     * List audit entries, newest first.
     *
     * @param tableName Optional table filter
     * @param pageable Page request
     * @return Page of entries
     */
    @Transactional(readOnly = true)
    public Page<AuditLog> listEntries(String tableName, Pageable pageable) {
        if (tableName == null || tableName.isBlank()) {
            return auditLogRepository.findAllByOrderByCreatedAtDesc(pageable);
        }
        return auditLogRepository.findByTableNameOrderByCreatedAtDesc(tableName, pageable);
    }

    private HttpServletRequest currentRequest() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes) {
            return ((ServletRequestAttributes) attributes).getRequest();
        }
        return null;
    }
}
