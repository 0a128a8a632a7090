package com.cred.freestyle.commerce.api.dto;

import com.cred.freestyle.commerce.domain.model.AuditLog;

import java.time.Instant;

/**
 * Audit trail entry. Old and new values are JSON snapshots.
 *
 * @author Commerce Platform Team
 */
public class AuditLogResponse {

    private String auditLogId;
    private String adminId;
    private String action;
    private String tableName;
    private String recordId;
    private String oldValues;
    private String newValues;
    private String ipAddress;
    private String userAgent;
    private Instant createdAt;

    public AuditLogResponse() {
    }

    public static AuditLogResponse fromEntity(AuditLog entry) {
        AuditLogResponse response = new AuditLogResponse();
        response.setAuditLogId(entry.getAuditLogId());
        response.setAdminId(entry.getAdminId());
        response.setAction(entry.getAction());
        response.setTableName(entry.getTableName());
        response.setRecordId(entry.getRecordId());
        response.setOldValues(entry.getOldValues());
        response.setNewValues(entry.getNewValues());
        response.setIpAddress(entry.getIpAddress());
        response.setUserAgent(entry.getUserAgent());
        response.setCreatedAt(entry.getCreatedAt());
        return response;
    }

    public String getAuditLogId() {
        return auditLogId;
    }

    public void setAuditLogId(String auditLogId) {
        this.auditLogId = auditLogId;
    }

    public String getAdminId() {
        return adminId;
    }

    public void setAdminId(String adminId) {
        this.adminId = adminId;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getRecordId() {
        return recordId;
    }

    public void setRecordId(String recordId) {
        this.recordId = recordId;
    }

    public String getOldValues() {
        return oldValues;
    }

    public void setOldValues(String oldValues) {
        this.oldValues = oldValues;
    }

    public String getNewValues() {
        return newValues;
    }

    public void setNewValues(String newValues) {
        this.newValues = newValues;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public void setIpAddress(String ipAddress) {
        this.ipAddress = ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
