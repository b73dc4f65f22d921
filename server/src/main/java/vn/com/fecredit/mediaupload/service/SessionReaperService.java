package vn.com.fecredit.mediaupload.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import vn.com.fecredit.mediaupload.core.SessionReaper;

/**
 * Runs the {@link SessionReaper} in the background, every 5 minutes unless configured otherwise.
 */
@Service
public class SessionReaperService {

    private static final Logger log = LoggerFactory.getLogger(SessionReaperService.class);

    private final SessionReaper sessionReaper;

    public SessionReaperService(SessionReaper sessionReaper) {
        this.sessionReaper = sessionReaper;
        log.info("Session reaper service initialized with ttl: {}, retention: {}",
                sessionReaper.getTtl(), sessionReaper.getRetention());
    }

    @Scheduled(fixedDelayString = "${mediaupload.reaper-interval-ms:300000}",
            initialDelayString = "${mediaupload.reaper-initial-delay-ms:60000}")
    public void sweepSessions() {
        log.debug("Triggering scheduled session sweep");
        sessionReaper.run();
    }
}
