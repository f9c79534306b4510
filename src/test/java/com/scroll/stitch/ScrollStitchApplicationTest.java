package com.scroll.stitch;

import com.scroll.stitch.config.StitchProperties;
import com.scroll.stitch.core.stitcher.SmartStitchStrategy;
import com.scroll.stitch.service.StitchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 完整上下文：application.yml 默认值绑定与核心组件装配
 */
@SpringBootTest(properties = "scroll-stitch.stitching.top-k=3")
public class ScrollStitchApplicationTest {

    @Autowired
    private StitchProperties properties;

    @Autowired
    private SmartStitchStrategy smartStitchStrategy;

    @Autowired
    private StitchService stitchService;

    @Test
    @DisplayName("Should bind configuration and wire the stitch strategies")
    void contextLoads() {
        assertThat(properties.getHash().getAlgorithm()).isEqualTo("dhash");
        assertThat(properties.getStitching().getIgnoreRightPixels()).isEqualTo(20);
        assertThat(smartStitchStrategy.getTopK()).isEqualTo(3);
        assertThat(stitchService.getDefaultStrategy()).isEqualTo("smart");
    }
}
