package com.framescan.framescan.service.video;

import java.awt.image.BufferedImage;
import java.io.Closeable;

import com.framescan.framescan.exception.VideoAccessException;
import com.framescan.framescan.model.VideoProperties;

/**
 * One opened video with a single decode cursor. Seeking and reading move the
 * same cursor, so an instance must only be driven by one thread at a time.
 */
public interface VideoSource extends Closeable {

    VideoProperties properties();

    void seekToFrame(long frameIndex) throws VideoAccessException;

    /**
     * Decodes the frame under the cursor and advances it.
     *
     * @return the frame in BGR channel order, or {@code null} at end of stream
     */
    BufferedImage readFrame() throws VideoAccessException;

    default BufferedImage readFrameAt(double timestamp) throws VideoAccessException {
        seekToFrame(properties().frameIndexAt(timestamp));
        return readFrame();
    }

    boolean isClosed();

    /** Idempotent. */
    @Override
    void close();
}
