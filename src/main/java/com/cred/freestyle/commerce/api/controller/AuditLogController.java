package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.dto.AuditLogResponse;
import com.cred.freestyle.commerce.api.dto.PageResponse;
import com.cred.freestyle.commerce.service.AuditService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the admin audit trail, newest first.
 *
 * @author Commerce Platform Team
 */
@RestController
@RequestMapping("/api/v1/admin/audit-logs")
@PreAuthorize("hasRole('ADMIN')")
public class AuditLogController {

    private final AuditService auditService;

    public AuditLogController(AuditService auditService) {
        this.auditService = auditService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<AuditLogResponse>> listEntries(
            @RequestParam(required = false) String tableName,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                auditService.listEntries(tableName, Pagination.of(page, size)), AuditLogResponse::fromEntity));
    }
}
