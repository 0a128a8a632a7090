package com.cred.freestyle.commerce.repository;

import com.cred.freestyle.commerce.domain.model.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for AuditLog entity. Rows are only ever inserted.
 *
 * @author Commerce Platform Team
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, String> {

    Page<AuditLog> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Page<AuditLog> findByTableNameOrderByCreatedAtDesc(String tableName, Pageable pageable);
}
