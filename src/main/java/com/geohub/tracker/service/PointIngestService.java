package com.geohub.tracker.service;

import com.geohub.tracker.dto.LogPointRequest;
import com.geohub.tracker.entity.GeoPoint;
import com.geohub.tracker.live.ChangePublisher;
import com.geohub.tracker.live.ChangeSourceException;
import com.geohub.tracker.live.ChannelKey;
import com.geohub.tracker.repository.GeoPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;

/**
 * Write side of the tracker: stores a point and announces it to live waiters.
 *
 * Flow:
 * 1. Build the entity (server time if the client sent none or an unparseable one)
 * 2. Persist it
 * 3. After the transaction commits, publish a change event for the session
 *
 * Publishing after commit matters: the dispatcher reacts by querying for new
 * rows, and must be able to see the one that triggered the event. A failed
 * publish is logged and does not fail the request; the point is stored, only
 * the wake-up is lost.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PointIngestService {

    private final GeoPointRepository pointRepository;
    private final ChangePublisher changePublisher;

    @Transactional
    public GeoPoint logPoint(ChannelKey key, LogPointRequest request, String note) {
        if (note != null && note.length() > GeoPoint.MAX_NOTE_LENGTH) {
            throw new IllegalArgumentException("Note exceeds " + GeoPoint.MAX_NOTE_LENGTH + " characters");
        }

        GeoPoint point = GeoPoint.builder()
            .client(key.client())
            .latitude(request.lat())
            .longitude(request.longitude())
            .speed(request.s())
            .elevation(request.ele())
            .accuracy(request.accuracy())
            .time(TimestampParser.parseOr(request.time(), Instant.now()))
            .note(note == null || note.isEmpty() ? null : note)
            .secretHash(SecretHasher.hash(key.secretOrNull()))
            .build();

        GeoPoint saved = pointRepository.save(point);
        log.debug("Logged point {} for {}: {}", saved.getId(), key, request.toLogString());

        publishAfterCommit(key);
        return saved;
    }

    private void publishAfterCommit(ChannelKey key) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publish(key);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publish(key);
            }
        });
    }

    private void publish(ChannelKey key) {
        try {
            changePublisher.publish(key);
        } catch (ChangeSourceException e) {
            log.warn("Couldn't send change notification for {}: {}", key, e.getMessage());
        }
    }
}
