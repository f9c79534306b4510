package com.scroll.stitch.core.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenCV 本地库加载器
 * <p>
 * 使用 openpnp 打包的本地库，按需加载一次。
 * 所有触碰 {@code org.opencv} 的类在首次使用前都必须调用 {@link #ensureLoaded()}。
 */
public final class OpenCvLoader {

    private static final Logger logger = LoggerFactory.getLogger(OpenCvLoader.class);

    private static boolean loaded = false;

    private OpenCvLoader() {
    }

    public static synchronized void ensureLoaded() {
        if (loaded) {
            return;
        }

        logger.info("Loading OpenCV native library via openpnp...");
        try {
            nu.pattern.OpenCV.loadLocally();
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV via openpnp: {}", e.getMessage());
            throw new IllegalStateException("OpenCV native library unavailable", e);
        }
        loaded = true;
        logger.info("OpenCV {} loaded successfully", org.opencv.core.Core.VERSION);
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}
