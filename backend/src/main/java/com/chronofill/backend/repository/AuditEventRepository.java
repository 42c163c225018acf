package com.chronofill.backend.repository;

import com.chronofill.backend.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {
    List<AuditEvent> findByResourceTypeAndResourceIdOrderByIdAsc(String resourceType, String resourceId);
}
