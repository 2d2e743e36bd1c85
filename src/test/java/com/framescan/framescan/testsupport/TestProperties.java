package com.framescan.framescan.testsupport;

import java.nio.file.Path;

import com.framescan.framescan.config.ScanProperties;

public final class TestProperties {

    private TestProperties() {
    }

    /** Fast ticks so coordinator tests finish in milliseconds. */
    public static ScanProperties fast() {
        ScanProperties properties = new ScanProperties();
        properties.getScan().setTickDelayMillis(2);
        properties.getScan().setTeardownAwaitMillis(3000);
        properties.getScan().setIdleTimeoutSeconds(30);
        return properties;
    }

    public static ScanProperties fast(Path storageRoot) {
        ScanProperties properties = fast();
        properties.getStorage().setUploadDir(storageRoot.resolve("videos").toString());
        properties.getStorage().setTempDir(storageRoot.resolve("temp").toString());
        return properties;
    }
}
