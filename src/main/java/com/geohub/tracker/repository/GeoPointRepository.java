package com.geohub.tracker.repository;

import com.geohub.tracker.entity.GeoPoint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for tracked points.
 *
 * Secret matching: a row is visible to a caller when its stored hash equals
 * the hash of the caller's secret, or when the row was logged without a
 * secret. A caller without a secret passes {@code null} and therefore only
 * sees public rows.
 */
@Repository
public interface GeoPointRepository extends JpaRepository<GeoPoint, Long> {

    /**
     * Range query used by the JSON and GPX retrieval endpoints.
     * Ordered by point time, oldest first.
     */
    @Query("""
        SELECT p FROM GeoPoint p
        WHERE p.client = :client
        AND p.time BETWEEN :from AND :to
        AND (p.secretHash IS NULL OR p.secretHash = :secretHash)
        AND p.id > :last
        ORDER BY p.time ASC
        """)
    List<GeoPoint> findInRange(
        @Param("client") String client,
        @Param("from") Instant from,
        @Param("to") Instant to,
        @Param("secretHash") String secretHash,
        @Param("last") long last,
        Pageable pageable
    );

    /**
     * Point query for rows newer than a cursor, newest first.
     * Backed by the (client, id) index; usually returns zero or a handful of rows.
     */
    @Query("""
        SELECT p FROM GeoPoint p
        WHERE p.client = :client
        AND p.id > :last
        AND (p.secretHash IS NULL OR p.secretHash = :secretHash)
        ORDER BY p.id DESC
        """)
    List<GeoPoint> findNewerThan(
        @Param("client") String client,
        @Param("last") long last,
        @Param("secretHash") String secretHash,
        Pageable pageable
    );

    long countByClient(String client);
}
