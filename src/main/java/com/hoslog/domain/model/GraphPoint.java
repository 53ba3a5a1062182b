package com.hoslog.domain.model;

import lombok.Value;

/**
 * Vertex of the step line drawn on the 24-hour grid: x in hours, y the status rank
 */
@Value
public class GraphPoint {
    double hour;
    int rank;
}
