package com.security.anomaly.persistence.service;

import com.security.anomaly.domain.NormalizedEvent;
import com.security.anomaly.persistence.EventStore;
import com.security.anomaly.persistence.EventStoreException;
import com.security.anomaly.persistence.entity.AnormalEventEntity;
import com.security.anomaly.persistence.repository.AnormalEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link EventStore} backed by PostgreSQL through Spring Data JPA.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventPersistenceService implements EventStore {

    private final AnormalEventRepository eventRepository;

    @Override
    @Transactional
    public void save(NormalizedEvent event) {
        AnormalEventEntity entity = AnormalEventEntity.builder()
                .serviceName(event.getServiceName())
                .ip(event.getIp())
                .eventType(event.getEventType())
                .severity(event.getSeverity())
                .description(event.getDescription())
                .occurredAt(event.getOccurredAt())
                .requestId(event.getRequestId())
                .method(event.getMethod())
                .path(event.getPath())
                .statusCode(event.getStatusCode())
                .userAgent(event.getUserAgent())
                .request(event.getRequest())
                .build();
        try {
            eventRepository.save(entity);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to persist event for ip=" + event.getIp(), e);
        }
        log.debug("Persisted security event: id={}, ip={}, eventType={}, severity={}",
                entity.getId(), entity.getIp(), entity.getEventType(), entity.getSeverity());
    }

    @Override
    @Transactional(readOnly = true)
    public List<NormalizedEvent> findWindow(Instant from, Instant to) {
        try {
            return eventRepository.findWindow(from, to).stream()
                    .map(EventPersistenceService::toEvent)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to read events in [" + from + ", " + to + ")", e);
        }
    }

    private static NormalizedEvent toEvent(AnormalEventEntity e) {
        return NormalizedEvent.builder()
                .serviceName(e.getServiceName())
                .ip(e.getIp())
                .eventType(e.getEventType() != null ? e.getEventType() : 0)
                .severity(e.getSeverity() != null ? e.getSeverity() : 0)
                .description(e.getDescription())
                .occurredAt(e.getOccurredAt())
                .requestId(e.getRequestId())
                .method(e.getMethod())
                .path(e.getPath())
                .statusCode(e.getStatusCode())
                .userAgent(e.getUserAgent())
                .request(e.getRequest())
                .build();
    }
}
