package com.framescan.framescan.service.scheduler;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.framescan.framescan.config.ScanProperties;
import com.framescan.framescan.service.session.ScanSession;
import com.framescan.framescan.service.session.SessionProtocol;
import com.framescan.framescan.service.session.SessionRegistry;

class KeepaliveSchedulerTest {

    private SessionRegistry registry;
    private SessionProtocol protocol;
    private KeepaliveScheduler scheduler;

    @BeforeEach
    void setUp() {
        registry = mock(SessionRegistry.class);
        protocol = mock(SessionProtocol.class);
        ScanProperties properties = new ScanProperties();
        properties.getScan().setUnclaimedSessionTtlSeconds(120);
        scheduler = new KeepaliveScheduler(registry, protocol, properties);
    }

    @Test
    void sweepChecksEveryActiveSession() {
        ScanSession first = mock(ScanSession.class);
        ScanSession second = mock(ScanSession.class);
        when(registry.activeSessions()).thenReturn(List.of(first, second));

        scheduler.sweep();

        verify(protocol).sendKeepaliveIfIdle(eq(first), anyLong());
        verify(protocol).sendKeepaliveIfIdle(eq(second), anyLong());
    }

    @Test
    void reapRemovesSessionsUnclaimedForTheTtl() {
        Instant before = Instant.now();

        scheduler.reapUnclaimed();

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(registry).removeUnclaimed(cutoff.capture());
        Duration age = Duration.between(cutoff.getValue(), before);
        assertTrue(age.compareTo(Duration.ofSeconds(119)) > 0 && age.compareTo(Duration.ofSeconds(121)) < 0,
                "cutoff should be about two minutes ago, was " + age);
    }
}
