package com.framescan.framescan.service.scheduler;

import java.time.Duration;
import java.time.Instant;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.framescan.framescan.config.ScanProperties;
import com.framescan.framescan.service.session.ScanSession;
import com.framescan.framescan.service.session.SessionProtocol;
import com.framescan.framescan.service.session.SessionRegistry;

/**
 * Periodic session housekeeping: the idle-timeout half of every session's
 * receive loop, and removal of uploads nobody ever connected to.
 */
@Component
public class KeepaliveScheduler {

    private final SessionRegistry registry;
    private final SessionProtocol protocol;
    private final Duration unclaimedTtl;

    public KeepaliveScheduler(SessionRegistry registry, SessionProtocol protocol, ScanProperties properties) {
        this.registry = registry;
        this.protocol = protocol;
        this.unclaimedTtl = properties.getScan().unclaimedSessionTtl();
    }

    @Scheduled(fixedDelayString = "${framescan.scan.keepalive-sweep-millis:1000}")
    public void sweep() {
        long now = System.currentTimeMillis();
        for (ScanSession session : registry.activeSessions()) {
            protocol.sendKeepaliveIfIdle(session, now);
        }
    }

    @Scheduled(fixedDelayString = "${framescan.scan.unclaimed-sweep-millis:60000}")
    public void reapUnclaimed() {
        registry.removeUnclaimed(Instant.now().minus(unclaimedTtl));
    }
}
