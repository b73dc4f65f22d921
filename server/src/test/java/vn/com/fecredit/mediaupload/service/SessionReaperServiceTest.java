package vn.com.fecredit.mediaupload.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import vn.com.fecredit.mediaupload.core.SessionReaper;

import java.time.Duration;

import static org.mockito.Mockito.*;

/**
 * Unit tests for SessionReaperService without a Spring context.
 */
@ExtendWith(MockitoExtension.class)
public class SessionReaperServiceTest {

    @Mock
    private SessionReaper sessionReaper;

    @Test
    public void testEachSweepRunsTheReaper() {
        when(sessionReaper.getTtl()).thenReturn(Duration.ofMinutes(30));
        when(sessionReaper.getRetention()).thenReturn(Duration.ofDays(7));
        SessionReaperService service = new SessionReaperService(sessionReaper);

        service.sweepSessions();
        service.sweepSessions();

        verify(sessionReaper, times(2)).run();
    }
}
