package com.hoslog.domain.model;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A driver's record of duty status for one calendar day.
 * Records are kept in start order and never reach outside [00:00, 24:00) of {@code date}
 * when built through {@link #assemble}.
 */
@Value
public class DailyLog {
    String driverId;
    LocalDate date;
    ZoneId zone;
    List<ActivityRecord> records;

    public DailyLog(String driverId, LocalDate date, ZoneId zone, List<ActivityRecord> records) {
        this.driverId = driverId;
        this.date = date;
        this.zone = zone;
        this.records = List.copyOf(records);
    }

    public static DailyLog empty(String driverId, LocalDate date, ZoneId zone) {
        return new DailyLog(driverId, date, zone, List.of());
    }

    /**
     * Builds the log for a date from records gathered from several sources.
     * Duplicate ids keep their first occurrence, records crossing midnight are split so only
     * the part inside the date remains, and the result is sorted by start time.
     */
    public static DailyLog assemble(String driverId, LocalDate date, ZoneId zone,
                                    Collection<ActivityRecord> candidates) {
        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant();

        Map<String, ActivityRecord> byId = new LinkedHashMap<>();
        for (ActivityRecord record : candidates) {
            byId.putIfAbsent(record.getId(), record);
        }

        List<ActivityRecord> records = new ArrayList<>();
        for (ActivityRecord record : byId.values()) {
            record.clipTo(dayStart, dayEnd).ifPresent(records::add);
        }
        records.sort(Comparator.comparing(ActivityRecord::getStartTime));
        return new DailyLog(driverId, date, zone, records);
    }

    public Instant dayStart() {
        return date.atStartOfDay(zone).toInstant();
    }

    /**
     * Midnight ending this day. Usually 24 hours after {@link #dayStart()}, except across
     * daylight-saving changes.
     */
    public Instant dayEnd() {
        return date.plusDays(1).atStartOfDay(zone).toInstant();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
