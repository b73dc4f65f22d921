package vn.com.fecredit.mediaupload.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic sweeper over upload sessions. Each run expires sessions idle for longer than
 * {@code ttl}, then purges terminal sessions older than {@code retention}.
 *
 * <p>
 * Meant to be driven by a fixed-delay scheduler. A failing run is logged and never
 * propagates, so the schedule keeps going.
 */
public class SessionReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);

    private final ChunkUploadEngine engine;
    private final Clock clock;
    @Getter
    private final Duration ttl;
    @Getter
    private final Duration retention;

    public SessionReaper(ChunkUploadEngine engine, Clock clock, Duration ttl, Duration retention) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Session TTL must be positive: " + ttl);
        }
        if (retention == null || retention.isNegative()) {
            throw new IllegalArgumentException("Retention must not be negative: " + retention);
        }
        this.engine = engine;
        this.clock = clock;
        this.ttl = ttl;
        this.retention = retention;
        log.info("Session reaper initialized with ttl: {}, retention: {}", ttl, retention);
    }

    @Override
    public void run() {
        Instant now = clock.instant();
        log.debug("Starting session sweep at {}", now);
        try {
            int expired = engine.expireStalled(now, ttl);
            int purged = engine.purgeTerminated(now, retention);
            log.debug("Completed session sweep: {} expired, {} purged", expired, purged);
        } catch (RuntimeException e) {
            log.error("Error during session sweep: {}", e.getMessage(), e);
        }
    }
}
