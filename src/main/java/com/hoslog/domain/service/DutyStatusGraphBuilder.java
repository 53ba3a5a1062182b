package com.hoslog.domain.service;

import com.hoslog.domain.exception.UnsortedOrOverlappingInputException;
import com.hoslog.domain.model.ActivityRecord;
import com.hoslog.domain.model.DailyLog;
import com.hoslog.domain.model.DutyStatusTimeline;
import com.hoslog.domain.model.Hours;
import com.hoslog.domain.model.OpenActivity;
import com.hoslog.domain.model.TimelineSegment;
import com.hoslog.domain.model.TimelineStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a daily log into the step function drawn on the driver's 24-hour graph.
 * <p>
 * Records must already be sorted and non-overlapping; the builder checks this but never
 * re-sorts. Time not covered by any record is emitted as {@link TimelineStatus#UNSPECIFIED}
 * so the whole day is accounted for. An open activity runs up to the reference instant and
 * is cut at midnight; the remainder belongs to the next day's graph.
 */
public class DutyStatusGraphBuilder {

    public DutyStatusTimeline buildTimeline(DailyLog dailyLog) {
        return buildTimeline(dailyLog, Optional.empty(), null);
    }

    public DutyStatusTimeline buildTimeline(DailyLog dailyLog, Optional<OpenActivity> openActivity,
                                            Instant referenceInstant) {
        Instant dayStart = dailyLog.dayStart();
        Instant dayEnd = dailyLog.dayEnd();

        List<Span> spans = new ArrayList<>();
        ActivityRecord previous = null;
        for (ActivityRecord record : dailyLog.getRecords()) {
            if (previous != null) {
                if (record.getStartTime().isBefore(previous.getStartTime())) {
                    throw new UnsortedOrOverlappingInputException("Record " + record.getId()
                            + " starts before the preceding record " + previous.getId());
                }
                if (record.getStartTime().isBefore(previous.getEndTime())) {
                    throw new UnsortedOrOverlappingInputException("Record " + record.getId()
                            + " overlaps record " + previous.getId());
                }
            }
            previous = record;
            addClipped(spans, record.getStartTime(), record.getEndTime(),
                    TimelineStatus.of(record.getStatus()), dayStart, dayEnd);
        }

        if (openActivity.isPresent()) {
            if (referenceInstant == null) {
                throw new IllegalArgumentException("referenceInstant is required with an open activity");
            }
            OpenActivity open = openActivity.get();
            if (previous != null && open.getStartTime().isBefore(previous.getEndTime())) {
                throw new UnsortedOrOverlappingInputException("Open activity " + open.getId()
                        + " starts before record " + previous.getId() + " ends");
            }
            addClipped(spans, open.getStartTime(), referenceInstant,
                    TimelineStatus.of(open.getStatus()), dayStart, dayEnd);
        }

        return new DutyStatusTimeline(dailyLog.getDate(), fillGaps(spans, dayStart, dayEnd));
    }

    private void addClipped(List<Span> spans, Instant start, Instant end, TimelineStatus status,
                            Instant dayStart, Instant dayEnd) {
        Instant from = start.isBefore(dayStart) ? dayStart : start;
        Instant to = end.isAfter(dayEnd) ? dayEnd : end;
        if (from.isBefore(to)) {
            spans.add(new Span(from, to, status));
        }
    }

    private List<TimelineSegment> fillGaps(List<Span> spans, Instant dayStart, Instant dayEnd) {
        List<TimelineSegment> segments = new ArrayList<>();
        Instant cursor = dayStart;
        for (Span span : spans) {
            if (span.start().isAfter(cursor)) {
                segments.add(segment(dayStart, cursor, span.start(), TimelineStatus.UNSPECIFIED));
            }
            segments.add(segment(dayStart, span.start(), span.end(), span.status()));
            cursor = span.end();
        }
        if (cursor.isBefore(dayEnd)) {
            segments.add(segment(dayStart, cursor, dayEnd, TimelineStatus.UNSPECIFIED));
        }
        return segments;
    }

    private TimelineSegment segment(Instant dayStart, Instant from, Instant to, TimelineStatus status) {
        return new TimelineSegment(
                Hours.of(Duration.between(dayStart, from)),
                Hours.of(Duration.between(dayStart, to)),
                status);
    }

    private record Span(Instant start, Instant end, TimelineStatus status) {}
}
