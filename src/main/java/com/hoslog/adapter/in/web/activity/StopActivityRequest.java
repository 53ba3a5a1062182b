package com.hoslog.adapter.in.web.activity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StopActivityRequest(
        Double odometer,
        Double engineHours
) {}
