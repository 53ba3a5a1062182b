package com.hoslog.domain.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Piecewise-constant duty status over the 24 hours of a day.
 * Segments are contiguous, ordered and together cover the whole day.
 */
@Value
public class DutyStatusTimeline {
    LocalDate date;
    List<TimelineSegment> segments;

    public DutyStatusTimeline(LocalDate date, List<TimelineSegment> segments) {
        this.date = date;
        this.segments = List.copyOf(segments);
    }

    public double unspecifiedHours() {
        return segments.stream()
                .filter(segment -> !segment.getStatus().isSpecified())
                .mapToDouble(TimelineSegment::lengthHours)
                .sum();
    }

    /**
     * Two points per segment, start and end at the segment's rank
     */
    public List<GraphPoint> graphPoints() {
        List<GraphPoint> points = new ArrayList<>(segments.size() * 2);
        for (TimelineSegment segment : segments) {
            points.add(new GraphPoint(segment.getStartHour(), segment.getRank()));
            points.add(new GraphPoint(segment.getEndHour(), segment.getRank()));
        }
        return points;
    }
}
