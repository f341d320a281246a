package com.geohub.tracker.service;

import com.geohub.tracker.dto.GeoJsonFeatureCollection;
import com.geohub.tracker.dto.LiveUpdateRecord;
import com.geohub.tracker.entity.GeoPoint;
import com.geohub.tracker.live.ChannelKey;
import com.geohub.tracker.live.Delta;
import com.geohub.tracker.live.DeltaFetcher;
import com.geohub.tracker.repository.GeoPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Read side of the tracker.
 *
 * Two access patterns:
 * 1. Range retrieval (JSON/GPX endpoints): everything in a time window,
 *    oldest first, capped by a limit.
 * 2. Delta retrieval ("last" endpoint and the live dispatcher): rows newer
 *    than a cursor, newest first. Served by the (client, id) index, so it
 *    stays cheap even though the dispatcher issues one per change event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class PointQueryService implements DeltaFetcher {

    public static final int DEFAULT_RANGE_LIMIT = 16384;
    public static final int DEFAULT_LAST_LIMIT = 256;

    static final String NO_ROWS = "No rows returned";

    private final GeoPointRepository pointRepository;

    /**
     * Points of a client within [from, to], oldest first.
     *
     * @param from  lower bound, defaults to the epoch
     * @param to    upper bound, defaults to now
     * @param limit maximum number of points, defaults to {@value #DEFAULT_RANGE_LIMIT}
     * @param last  only points with a greater id (cursor), defaults to 0
     */
    public List<GeoPoint> findRange(ChannelKey key, Instant from, Instant to, Integer limit, Long last) {
        Instant lower = from == null ? Instant.EPOCH : from;
        Instant upper = to == null ? Instant.now() : to;
        int max = positiveOr(limit, DEFAULT_RANGE_LIMIT);

        List<GeoPoint> points = pointRepository.findInRange(
            key.client(),
            lower,
            upper,
            SecretHasher.hash(key.secretOrNull()),
            last == null ? 0L : last,
            PageRequest.of(0, max)
        );
        log.debug("Range query for {} [{} .. {}] returned {} point(s)", key, lower, upper, points.size());
        return points;
    }

    public GeoJsonFeatureCollection retrieveGeoJson(ChannelKey key, Instant from, Instant to, Integer limit, Long last) {
        return GeoJsonFeatureCollection.fromPoints(findRange(key, from, to, limit, last));
    }

    /**
     * Newest points after {@code last}, newest first, wrapped like a live update.
     * Used by clients to backfill recent history before they start waiting.
     */
    public LiveUpdateRecord retrieveLast(ChannelKey key, Long last, Integer limit) {
        Delta delta = fetch(key, last, positiveOr(limit, DEFAULT_LAST_LIMIT));
        if (delta.isPresent()) {
            return LiveUpdateRecord.update(key.client(), delta.last(), delta.geo());
        }
        return LiveUpdateRecord.noUpdate(key.client(), last, NO_ROWS);
    }

    @Override
    public Delta fetch(ChannelKey key, Long cursor, int limit) {
        List<GeoPoint> rows = pointRepository.findNewerThan(
            key.client(),
            cursor == null ? 0L : cursor,
            SecretHasher.hash(key.secretOrNull()),
            PageRequest.of(0, Math.max(1, limit))
        );
        if (rows.isEmpty()) {
            return Delta.absent();
        }
        long maxId = 0;
        for (GeoPoint row : rows) {
            if (row.getId() != null && row.getId() > maxId) {
                maxId = row.getId();
            }
        }
        return Delta.of(GeoJsonFeatureCollection.fromPoints(rows), maxId);
    }

    private static int positiveOr(Integer value, int fallback) {
        return value == null || value < 1 ? fallback : value;
    }
}
