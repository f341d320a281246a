package com.geohub.tracker.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Query parameters of {@code POST /geo/{client}/log}.
 *
 * Parameter names are part of the public API used by existing trackers
 * (e.g. {@code ?lat=52.5&longitude=13.4&s=3.2}), which is why some of them are terse.
 *
 * @param lat       latitude in decimal degrees (WGS84)
 * @param longitude longitude in decimal degrees (WGS84)
 * @param time      optional point time, any format {@code TimestampParser} accepts
 * @param s         optional speed
 * @param ele       optional elevation in meters
 * @param accuracy  optional accuracy in meters
 * @param secret    optional session secret
 */
public record LogPointRequest(
    @NotNull(message = "lat is required")
    @DecimalMin(value = "-90.0", message = "lat must be >= -90")
    @DecimalMax(value = "90.0", message = "lat must be <= 90")
    Double lat,

    @NotNull(message = "longitude is required")
    @DecimalMin(value = "-180.0", message = "longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "longitude must be <= 180")
    Double longitude,

    String time,

    Double s,

    Double ele,

    @PositiveOrZero(message = "accuracy must be >= 0")
    Double accuracy,

    String secret
) {

    public String toLogString() {
        return String.format("LogPoint[lat=%.6f, lon=%.6f, time=%s]", lat, longitude, time);
    }
}
