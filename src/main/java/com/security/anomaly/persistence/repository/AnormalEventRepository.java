package com.security.anomaly.persistence.repository;

import com.security.anomaly.persistence.entity.AnormalEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for stored security events.
 */
@Repository
public interface AnormalEventRepository extends JpaRepository<AnormalEventEntity, Long> {

    @Query("SELECT e FROM AnormalEventEntity e WHERE e.occurredAt >= :from AND e.occurredAt < :to")
    List<AnormalEventEntity> findWindow(@Param("from") Instant from, @Param("to") Instant to);
}
