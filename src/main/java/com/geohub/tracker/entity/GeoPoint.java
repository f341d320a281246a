package com.geohub.tracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single tracked GPS point.
 *
 * The generated id doubles as the client-visible cursor ("last"): it only
 * grows, so "rows with id &gt; last" is exactly the set a client has not seen.
 *
 * Secrets are never stored in clear text; {@code secretHash} holds the
 * lowercase hex SHA-256 of the secret, or null for public points.
 */
@Entity
@Table(
    name = "geodata",
    indexes = {
        @Index(name = "idx_geodata_client_id", columnList = "client, id"),
        @Index(name = "idx_geodata_client_time", columnList = "client, t")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeoPoint {

    public static final int MAX_NOTE_LENGTH = 4096;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String client;

    @Column(name = "lat")
    private Double latitude;

    @Column(name = "long")
    private Double longitude;

    @Column(name = "spd")
    private Double speed;

    @Column(name = "ele")
    private Double elevation;

    private Double accuracy;

    @Column(name = "t", nullable = false)
    private Instant time;

    @Column(length = MAX_NOTE_LENGTH)
    private String note;

    @Column(name = "secret", length = 64)
    private String secretHash;
}
