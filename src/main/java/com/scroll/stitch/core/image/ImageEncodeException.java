package com.scroll.stitch.core.image;

/**
 * 结果图像编码失败
 */
public class ImageEncodeException extends RuntimeException {

    public ImageEncodeException(String message) {
        super(message);
    }
}
