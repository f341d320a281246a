package com.geohub.tracker.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Response of the live and "last" retrieval endpoints.
 *
 * Two shapes exist:
 * <ul>
 *   <li>update: {@code geo} holds the new points, {@code last} is the highest id among them</li>
 *   <li>no update: {@code geo} is null, {@code last} is the cursor the client sent
 *       (unchanged, may be null) and {@code error} explains why</li>
 * </ul>
 *
 * In both cases the client can re-issue the same request with {@code last}.
 *
 * @param type   always "GeoHubUpdate"
 * @param client client name the update belongs to
 * @param last   cursor to send with the next request
 * @param geo    new points, or null
 * @param error  reason for an empty result, or null
 */
@JsonPropertyOrder({"type", "client", "last", "geo", "error"})
public record LiveUpdateRecord(
    String type,
    String client,
    Long last,
    GeoJsonFeatureCollection geo,
    String error
) {

    public static final String TYPE = "GeoHubUpdate";

    public static LiveUpdateRecord update(String client, Long last, GeoJsonFeatureCollection geo) {
        return new LiveUpdateRecord(TYPE, client, last, geo, null);
    }

    public static LiveUpdateRecord noUpdate(String client, Long last, String error) {
        return new LiveUpdateRecord(TYPE, client, last, null, error);
    }

    public boolean hasUpdate() {
        return geo != null;
    }
}
