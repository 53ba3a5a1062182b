package com.hoslog.adapter.out.persistence;

import com.hoslog.application.port.out.ActivityRecordRepository;
import com.hoslog.domain.model.ActivityRecord;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ActivityRecordRepository.
 * Records are keyed by id per driver, so saving the same record twice keeps one copy.
 */
@Slf4j
public class InMemoryActivityRecordAdapter implements ActivityRecordRepository {

    private final Map<String, Map<String, ActivityRecord>> recordsByDriver = new ConcurrentHashMap<>();

    @Override
    public Future<Void> save(String driverId, ActivityRecord record) {
        recordsByDriver
                .computeIfAbsent(driverId, id -> new ConcurrentHashMap<>())
                .put(record.getId(), record);
        log.debug("Stored activity {} for driver {}", record.getId(), driverId);
        return Future.succeededFuture();
    }

    @Override
    public Future<List<ActivityRecord>> findByDriverBetween(String driverId, Instant from, Instant to) {
        Map<String, ActivityRecord> records = recordsByDriver.getOrDefault(driverId, Map.of());
        List<ActivityRecord> result = records.values().stream()
                .filter(record -> record.overlaps(from, to))
                .sorted(Comparator.comparing(ActivityRecord::getStartTime))
                .collect(Collectors.toCollection(ArrayList::new));
        log.debug("Found {} stored activities for driver {} between {} and {}", result.size(), driverId, from, to);
        return Future.succeededFuture(result);
    }
}
