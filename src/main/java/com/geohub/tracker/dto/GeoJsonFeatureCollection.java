package com.geohub.tracker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.geohub.tracker.entity.GeoPoint;

import java.time.Instant;
import java.util.List;

/**
 * GeoJSON FeatureCollection of tracked points (RFC 7946).
 *
 * Wire format:
 * <pre>
 * {
 *   "type": "FeatureCollection",
 *   "features": [
 *     {
 *       "type": "Feature",
 *       "properties": {"id": 17, "time": "2024-01-01T12:00:00Z", "altitude": 40.1,
 *                      "speed": 3.2, "accuracy": 5.0, "note": null},
 *       "geometry": {"type": "Point", "coordinates": [13.4, 52.5]}
 *     }
 *   ]
 * }
 * </pre>
 *
 * Coordinates follow GeoJSON order: longitude first, then latitude.
 */
@JsonPropertyOrder({"type", "features"})
public record GeoJsonFeatureCollection(
    @JsonProperty("type") String type,
    List<Feature> features
) {

    public static GeoJsonFeatureCollection of(List<Feature> features) {
        return new GeoJsonFeatureCollection("FeatureCollection", List.copyOf(features));
    }

    public static GeoJsonFeatureCollection fromPoints(List<GeoPoint> points) {
        return of(points.stream().map(Feature::fromEntity).toList());
    }

    @JsonPropertyOrder({"type", "properties", "geometry"})
    public record Feature(
        @JsonProperty("type") String type,
        Properties properties,
        Geometry geometry
    ) {

        public static Feature fromEntity(GeoPoint point) {
            return new Feature(
                "Feature",
                new Properties(
                    point.getId(),
                    point.getTime(),
                    point.getElevation(),
                    point.getSpeed(),
                    point.getAccuracy(),
                    point.getNote()
                ),
                Geometry.point(point.getLatitude(), point.getLongitude())
            );
        }
    }

    public record Properties(
        Long id,
        Instant time,
        Double altitude,
        Double speed,
        Double accuracy,
        String note
    ) {
    }

    @JsonPropertyOrder({"type", "coordinates"})
    public record Geometry(
        @JsonProperty("type") String type,
        List<Double> coordinates
    ) {

        /**
         * Missing coordinates are written as 0.0, matching how older clients read them.
         */
        public static Geometry point(Double latitude, Double longitude) {
            double lon = longitude == null ? 0.0 : longitude;
            double lat = latitude == null ? 0.0 : latitude;
            return new Geometry("Point", List.of(lon, lat));
        }
    }
}
