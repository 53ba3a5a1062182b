package com.hoslog.adapter.in.web.activity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of POST /api/drivers/:driverId/activities/start. Status is a wire code (DRIVING, ONDUTY, ...).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StartActivityRequest(
        String status,
        String location,
        String notes
) {}
