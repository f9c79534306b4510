package com.scroll.stitch.config;

import com.scroll.stitch.core.hash.ImageHasher;
import com.scroll.stitch.core.hash.RowHasher;
import com.scroll.stitch.core.image.OpenCvLoader;
import com.scroll.stitch.core.matcher.SequenceMatcher;
import com.scroll.stitch.core.stitcher.DirectStitchStrategy;
import com.scroll.stitch.core.stitcher.SmartStitchStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 拼接引擎配置
 * <p>
 * 从 application.yml 读取默认参数，装配无状态的核心组件
 */
@Configuration
public class StitchEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(StitchEngineConfig.class);

    @Bean
    public ImageHasher imageHasher() {
        OpenCvLoader.ensureLoaded();
        return new ImageHasher();
    }

    @Bean
    public RowHasher rowHasher() {
        return new RowHasher();
    }

    @Bean
    public SequenceMatcher sequenceMatcher() {
        return new SequenceMatcher();
    }

    @Bean
    public DirectStitchStrategy directStitchStrategy(RowHasher rowHasher, SequenceMatcher sequenceMatcher,
                                                     StitchProperties properties) {
        StitchProperties.StitchingConfig config = properties.getStitching();
        logger.info("DirectStitchStrategy 配置: ignoreRightPixels={}, minOverlapRatio={}",
                config.getIgnoreRightPixels(), config.getMinOverlapRatio());
        return new DirectStitchStrategy(rowHasher, sequenceMatcher,
                config.getIgnoreRightPixels(), config.getMinOverlapRatio());
    }

    @Bean
    public SmartStitchStrategy smartStitchStrategy(RowHasher rowHasher, SequenceMatcher sequenceMatcher,
                                                   StitchProperties properties) {
        StitchProperties.StitchingConfig config = properties.getStitching();
        logger.info("SmartStitchStrategy 配置: ignoreRightPixels={}, minOverlapRatio={}, topK={}",
                config.getIgnoreRightPixels(), config.getSmartMinOverlapRatio(), config.getTopK());
        return new SmartStitchStrategy(rowHasher, sequenceMatcher,
                config.getIgnoreRightPixels(), config.getSmartMinOverlapRatio(), config.getTopK());
    }
}
