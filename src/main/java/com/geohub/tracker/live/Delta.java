package com.geohub.tracker.live;

import com.geohub.tracker.dto.GeoJsonFeatureCollection;

/**
 * Rows newer than a cursor for one session, plus the highest id among them.
 *
 * {@link #absent()} is the explicit "nothing found or lookup failed" result;
 * waiters receive it instead of silence so they never hang until their timeout.
 *
 * @param geo  the new points, null when absent
 * @param last highest id in {@code geo}, null when absent
 */
public record Delta(GeoJsonFeatureCollection geo, Long last) {

    private static final Delta ABSENT = new Delta(null, null);

    public static Delta of(GeoJsonFeatureCollection geo, long last) {
        return new Delta(geo, last);
    }

    public static Delta absent() {
        return ABSENT;
    }

    public boolean isPresent() {
        return geo != null;
    }
}
