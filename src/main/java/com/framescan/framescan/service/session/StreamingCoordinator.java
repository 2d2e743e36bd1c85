package com.framescan.framescan.service.session;

import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.framescan.framescan.config.ScanProperties;
import com.framescan.framescan.exception.SessionException;
import com.framescan.framescan.model.ClassificationResult;
import com.framescan.framescan.model.VideoProperties;
import com.framescan.framescan.model.dto.ClassificationEvent;
import com.framescan.framescan.model.dto.ErrorEvent;

/**
 * Ambient scanning of an attached session. A virtual clock starts at 0 and
 * advances a fixed interval per tick; each tick classifies the frame under the
 * clock and pushes the result to the client, until the clock passes the end of
 * the video, the connection goes away, or the task is cancelled.
 */
@Service
public class StreamingCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(StreamingCoordinator.class);

    private final FrameClassificationService classificationService;
    private final SessionEventPublisher publisher;
    private final double tickInterval;
    private final Duration tickDelay;

    public StreamingCoordinator(FrameClassificationService classificationService, SessionEventPublisher publisher,
            ScanProperties properties) {
        this.classificationService = classificationService;
        this.publisher = publisher;
        this.tickInterval = properties.getScan().getTickIntervalSeconds();
        this.tickDelay = properties.getScan().tickDelay();
    }

    public CoordinatorTask newTask(ScanSession session) {
        return new CoordinatorTask(session.getId(), task -> runLoop(session, task));
    }

    void runLoop(ScanSession session, CoordinatorTask task) {
        VideoProperties properties = session.getProperties();
        if (properties == null) {
            logger.warn("Session {}: coordinator started before attach, exiting", session.getId());
            return;
        }

        double duration = properties.getDuration();
        double clock = 0.0;
        int ticks = 0;
        int emitted = 0;

        logger.info("Session {}: scanning {}s every {}s", session.getId(), duration, tickInterval);

        try {
            while (!task.isCancelled()) {
                if (clock >= duration || session.isClosing() || !session.hasOpenConnection()) {
                    break;
                }

                try {
                    Optional<ClassificationResult> result = classificationService.classifyAt(session, clock);
                    if (result.isPresent() && publisher.publish(session, new ClassificationEvent(result.get()))) {
                        emitted++;
                    }
                } catch (SessionException e) {
                    if (e.getError().isFatal()) {
                        logger.debug("Session {}: coordinator stopping on {}", session.getId(), e.getError());
                        break;
                    }
                    logger.warn("Session {}: tick at {}s failed: {}", session.getId(), clock, e.getMessage());
                    publisher.publish(session, new ErrorEvent(e.getMessage()));
                } catch (RuntimeException e) {
                    logger.error("Session {}: unexpected error at {}s", session.getId(), clock, e);
                    publisher.publish(session, new ErrorEvent("Processing error at " + clock + "s"));
                }

                ticks++;
                clock += tickInterval;

                if (!task.pause(tickDelay)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Session {}: coordinator interrupted", session.getId());
        }

        logger.info("Session {}: coordinator finished after {} ticks, {} results sent (clock {}s{})",
                session.getId(), ticks, emitted, clock, task.isCancelled() ? ", cancelled" : "");
    }
}
