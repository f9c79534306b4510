package com.scroll.stitch.core.image;

/**
 * 图像字节无法解码（格式损坏、为空或不受支持）
 */
public class ImageDecodeException extends RuntimeException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
