package com.geohub.tracker.controller;

import com.geohub.tracker.dto.GeoJsonFeatureCollection;
import com.geohub.tracker.dto.LiveUpdateRecord;
import com.geohub.tracker.dto.LogPointRequest;
import com.geohub.tracker.entity.GeoPoint;
import com.geohub.tracker.live.ChannelKey;
import com.geohub.tracker.live.LiveDispatcher;
import com.geohub.tracker.service.ClientIdentifiers;
import com.geohub.tracker.service.GpxWriter;
import com.geohub.tracker.service.InvalidIdentifierException;
import com.geohub.tracker.service.LiveUpdateService;
import com.geohub.tracker.service.PointIngestService;
import com.geohub.tracker.service.PointQueryService;
import com.geohub.tracker.service.TimestampParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HTTP surface of the tracker.
 *
 * Endpoints:
 * 1. POST /geo/{client}/log: store a point
 * 2. GET /geo/{client}/retrieve/json: points in a time range as GeoJSON
 * 3. GET /geo/{client}/retrieve/gpx: same, as GPX
 * 4. GET /geo/{client}/retrieve/last: newest points after a cursor
 * 5. GET /geo/{client}/retrieve/live: long-poll for the next point
 *
 * Every endpoint validates the client name and secret before touching the
 * database or the live dispatcher.
 */
@RestController
@RequestMapping("/geo")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "GeoHub", description = "GPS point ingestion and retrieval")
public class GeoHubController {

    private final PointIngestService ingestService;
    private final PointQueryService queryService;
    private final LiveUpdateService liveUpdateService;

    /**
     * Ingest a point.
     *
     * Example:
     * POST /geo/alice/log?lat=52.52&amp;longitude=13.40&amp;time=2020-11-30T20:12:36.444Z&amp;s=3.2
     * (optional plain-text note as request body)
     */
    @Operation(
            summary = "Log a GPS point",
            description = "Stores a point for the client and wakes live waiters of the same session. " +
                    "Without `time` the server time is used. The request body may hold a note of up to 4096 characters."
    )
    @PostMapping("/{client}/log")
    public ResponseEntity<?> logPoint(
            @Parameter(description = "Client name", example = "alice") @PathVariable String client,
            @Valid @ModelAttribute LogPointRequest request,
            BindingResult bindingResult,
            @RequestBody(required = false) String note
    ) {
        ChannelKey key = ClientIdentifiers.require(client, request.secret());

        if (bindingResult.hasErrors()) {
            String errors = bindingResult.getFieldErrors().stream()
                    .map(FieldError::getDefaultMessage)
                    .collect(Collectors.joining("; "));
            log.debug("Rejected point for {}: {}", key, errors);
            return ResponseEntity.badRequest().body(Map.of("error", errors));
        }
        if (note != null && note.length() > GeoPoint.MAX_NOTE_LENGTH) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Note too long: at most " + GeoPoint.MAX_NOTE_LENGTH + " characters allowed"
            ));
        }

        GeoPoint saved = ingestService.logPoint(key, request, note);
        log.info("Logged point {} for client {}", saved.getId(), client);
        return ResponseEntity.ok().build();
    }

    @Operation(
            summary = "Retrieve points as GeoJSON",
            description = "Points of the client between `from` (default: epoch) and `to` (default: now), oldest first. " +
                    "`last` skips points up to that id; `limit` defaults to 16384."
    )
    @GetMapping(value = "/{client}/retrieve/json", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GeoJsonFeatureCollection> retrieveJson(
            @PathVariable String client,
            @RequestParam(required = false) String secret,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long last
    ) {
        ChannelKey key = ClientIdentifiers.require(client, secret);
        return ResponseEntity.ok(queryService.retrieveGeoJson(key, parseTime(from), parseTime(to), limit, last));
    }

    @Operation(
            summary = "Retrieve points as GPX",
            description = "Same selection as the JSON endpoint, rendered as a single GPX 1.1 track."
    )
    @GetMapping("/{client}/retrieve/gpx")
    public ResponseEntity<String> retrieveGpx(
            @PathVariable String client,
            @RequestParam(required = false) String secret,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long last
    ) {
        ChannelKey key = ClientIdentifiers.require(client, secret);
        List<GeoPoint> points = queryService.findRange(key, parseTime(from), parseTime(to), limit, last);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(GpxWriter.MEDIA_TYPE))
                .body(GpxWriter.write(client, points));
    }

    @Operation(
            summary = "Retrieve the newest points",
            description = "Newest points after cursor `last`, newest first (`limit` defaults to 256). " +
                    "Used to backfill history before starting a live wait."
    )
    @GetMapping(value = "/{client}/retrieve/last", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LiveUpdateRecord> retrieveLast(
            @PathVariable String client,
            @RequestParam(required = false) String secret,
            @RequestParam(required = false) Long last,
            @RequestParam(required = false) Integer limit
    ) {
        ChannelKey key = ClientIdentifiers.require(client, secret);
        return ResponseEntity.ok(queryService.retrieveLast(key, last, limit));
    }

    @Operation(
            summary = "Wait for the next point",
            description = "Blocks until the next point of the session is logged, or until `timeout` seconds " +
                    "(default 30) pass. On timeout, `error` is set and `last` is returned unchanged."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Update or timeout",
                    content = @Content(
                            mediaType = "application/json",
                            examples = {
                                    @ExampleObject(
                                            name = "Update",
                                            value = "{\"type\":\"GeoHubUpdate\",\"client\":\"alice\",\"last\":42,\"geo\":{\"type\":\"FeatureCollection\",\"features\":[{\"type\":\"Feature\",\"properties\":{\"id\":42,\"time\":\"2024-01-01T12:00:00Z\",\"altitude\":null,\"speed\":null,\"accuracy\":null,\"note\":null},\"geometry\":{\"type\":\"Point\",\"coordinates\":[2.0,1.0]}}]},\"error\":null}"
                                    ),
                                    @ExampleObject(
                                            name = "Timeout",
                                            value = "{\"type\":\"GeoHubUpdate\",\"client\":\"alice\",\"last\":41,\"geo\":null,\"error\":\"No new rows\"}"
                                    )
                            }
                    )
            )
    })
    @GetMapping(value = "/{client}/retrieve/live", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LiveUpdateRecord> retrieveLive(
            @PathVariable String client,
            @RequestParam(required = false) String secret,
            @Parameter(description = "Seconds to wait", example = "30") @RequestParam(required = false) Integer timeout,
            @RequestParam(required = false) Long last
    ) {
        ChannelKey key = ClientIdentifiers.require(client, secret);
        return ResponseEntity.ok(liveUpdateService.waitForUpdate(key, timeout, last));
    }

    @GetMapping("/live/stats")
    public ResponseEntity<LiveDispatcher.Stats> liveStats() {
        return ResponseEntity.ok(liveUpdateService.stats());
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "GeoHub Tracker",
            "liveDispatcher", liveUpdateService.stats().running() ? "RUNNING" : "STOPPED",
            "timestamp", Instant.now()
        ));
    }

    @ExceptionHandler(InvalidIdentifierException.class)
    public ResponseEntity<Map<String, String>> handleInvalidIdentifier(InvalidIdentifierException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, String>> handleDataAccess(DataAccessException e) {
        log.error("Database error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", String.valueOf(e.getMostSpecificCause().getMessage())));
    }

    private static Instant parseTime(String value) {
        return TimestampParser.parse(value).orElse(null);
    }
}
