package com.scroll.stitch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scroll-stitch")
public class StitchProperties {
    private HashConfig hash = new HashConfig();
    private StitchingConfig stitching = new StitchingConfig();

    @Data
    public static class HashConfig {
        private String algorithm = "dhash";   // dhash, ahash, phash
        private int size = 8;                 // 8 -> 64 位指纹
        private String batchPolicy = "strict"; // strict, lenient
    }

    @Data
    public static class StitchingConfig {
        private String strategy = "smart";    // direct, smart
        private int ignoreRightPixels = 20;   // 排除右侧滚动条
        private double minOverlapRatio = 0.1;
        private double smartMinOverlapRatio = 0.01;
        private int topK = 5;
    }
}
