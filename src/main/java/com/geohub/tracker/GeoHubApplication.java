package com.geohub.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for GeoHub Tracker.
 *
 * Architecture Overview:
 * Trackers log GPS points over HTTP; viewers read them back as GeoJSON/GPX
 * or long-poll for the next point.
 *
 * Flow of a live update:
 * 1. A viewer calls /geo/{client}/retrieve/live and its request thread blocks
 * 2. The live dispatcher subscribes to the session's change channel
 * 3. A tracker logs a point; after commit a change event is published
 * 4. The dispatcher fetches the new row and answers every waiting viewer
 *    of that session
 */
@SpringBootApplication
public class GeoHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeoHubApplication.class, args);
    }
}
