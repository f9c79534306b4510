package com.scroll.stitch;

import com.scroll.stitch.core.image.OpenCvLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScrollStitchApplication {

    public static void main(String[] args) {
        // 必须在任何 OpenCV 调用之前加载本地库
        OpenCvLoader.ensureLoaded();
        SpringApplication.run(ScrollStitchApplication.class, args);
    }
}
