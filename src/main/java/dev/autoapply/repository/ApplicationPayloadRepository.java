package dev.autoapply.repository;

import dev.autoapply.entity.ApplicationPayloadRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for per-entry submission payloads, keyed by queue id.
 */
@Repository
public interface ApplicationPayloadRepository extends JpaRepository<ApplicationPayloadRecord, Long> {
}
