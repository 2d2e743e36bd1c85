package com.framescan.framescan.service.session;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.framescan.framescan.service.video.VideoSource;

/**
 * Releases the decoder handles and files that sessions leave behind.
 * Every method logs and carries on rather than throwing, so one failed step
 * never stops the next one from running.
 */
@Component
public class SessionResourceManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionResourceManager.class);

    /**
     * Close the session's video source. Waits for any in-flight seek/read to
     * finish by taking the cursor lock first.
     */
    public void closeVideoSource(ScanSession session) {
        session.cursorLock().lock();
        try {
            VideoSource source = session.getVideoSource();
            if (source == null) {
                return;
            }
            session.setVideoSource(null);
            try {
                source.close();
                logger.debug("Video source closed for session {}", session.getId());
            } catch (Exception e) {
                logger.error("Error closing video source for session {}: {}", session.getId(), e.getMessage(), e);
            }
        } finally {
            session.cursorLock().unlock();
        }
    }

    /**
     * Delete a session's backing video file. A file that is already gone is not an error.
     *
     * @return true if a file was deleted by this call
     */
    public boolean deleteVideoFile(Path videoPath) {
        if (videoPath == null) {
            return false;
        }
        try {
            boolean deleted = Files.deleteIfExists(videoPath);
            if (deleted) {
                logger.info("Deleted video file: {}", videoPath);
            } else {
                logger.debug("Video file already gone: {}", videoPath);
            }
            return deleted;
        } catch (IOException e) {
            logger.error("Failed to delete video file {}: {}", videoPath, e.getMessage());
            return false;
        }
    }

    /**
     * Delete every regular file directly inside {@code directory}.
     *
     * @return names of the files that were deleted
     * @throws IOException if the directory itself cannot be listed
     */
    public List<String> purgeDirectory(Path directory) throws IOException {
        List<String> deleted = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            logger.debug("Nothing to purge, not a directory: {}", directory);
            return deleted;
        }

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                if (!Files.isRegularFile(entry)) {
                    continue;
                }
                try {
                    if (Files.deleteIfExists(entry)) {
                        deleted.add(entry.getFileName().toString());
                        logger.trace("Deleted: {}", entry);
                    }
                } catch (IOException e) {
                    logger.error("Failed to delete: {} - {}", entry, e.getMessage());
                }
            }
        }
        return deleted;
    }
}
