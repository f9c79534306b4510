package com.scroll.stitch.core.image;

import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

/**
 * 内存图像编解码
 * <p>
 * 输入：OpenCV 支持的任意常见格式（PNG/JPEG/BMP/WebP...）
 * 输出：固定为无损 PNG
 * <p>
 * 解码后统一为 4 通道 8 位 BGRA，调用方负责释放返回的 Mat。
 */
public final class ImageCodec {

    static {
        OpenCvLoader.ensureLoaded();
    }

    private ImageCodec() {
    }

    /**
     * 解码为 BGRA (CV_8UC4)
     */
    public static Mat decodeBgra(byte[] bytes) {
        return decodeBgra(bytes, "image");
    }

    /**
     * 解码为 BGRA (CV_8UC4)
     *
     * @param label 出错时写进异常信息的图像名称，例如 "image 2"
     */
    public static Mat decodeBgra(byte[] bytes, String label) {
        Mat raw = decodeRaw(bytes, label);
        try {
            return toBgra(raw);
        } finally {
            raw.release();
        }
    }

    /**
     * 解码为单通道灰度 (CV_8UC1)
     */
    public static Mat decodeGray(byte[] bytes) {
        Mat raw = decodeRaw(bytes, "image");
        try {
            return toGray(raw);
        } finally {
            raw.release();
        }
    }

    /**
     * 编码为 PNG 字节流
     */
    public static byte[] encodePng(Mat image) {
        if (image == null || image.empty()) {
            throw new ImageEncodeException("Failed to encode result: image is empty");
        }
        MatOfByte buffer = new MatOfByte();
        try {
            boolean ok;
            try {
                ok = Imgcodecs.imencode(".png", image, buffer, new MatOfInt(Imgcodecs.IMWRITE_PNG_COMPRESSION, 3));
            } catch (CvException e) {
                throw new ImageEncodeException("Failed to encode result: " + e.getMessage());
            }
            if (!ok) {
                throw new ImageEncodeException("Failed to encode result: imencode returned false");
            }
            return buffer.toArray();
        } finally {
            buffer.release();
        }
    }

    /**
     * 任意 8 位图像转 BGRA，总是返回新的 Mat
     */
    public static Mat toBgra(Mat src) {
        Mat dst = new Mat();
        switch (src.channels()) {
            case 1:
                Imgproc.cvtColor(src, dst, Imgproc.COLOR_GRAY2BGRA);
                break;
            case 3:
                Imgproc.cvtColor(src, dst, Imgproc.COLOR_BGR2BGRA);
                break;
            case 4:
                src.copyTo(dst);
                break;
            default:
                dst.release();
                throw new ImageDecodeException("Unsupported channel count: " + src.channels());
        }
        return dst;
    }

    /**
     * 任意 8 位图像转灰度，总是返回新的 Mat
     */
    public static Mat toGray(Mat src) {
        Mat dst = new Mat();
        switch (src.channels()) {
            case 1:
                src.copyTo(dst);
                break;
            case 3:
                Imgproc.cvtColor(src, dst, Imgproc.COLOR_BGR2GRAY);
                break;
            case 4:
                Imgproc.cvtColor(src, dst, Imgproc.COLOR_BGRA2GRAY);
                break;
            default:
                dst.release();
                throw new ImageDecodeException("Unsupported channel count: " + src.channels());
        }
        return dst;
    }

    private static Mat decodeRaw(byte[] bytes, String label) {
        if (bytes == null || bytes.length == 0) {
            throw new ImageDecodeException("Failed to load " + label + ": empty buffer");
        }

        MatOfByte buffer = new MatOfByte(bytes);
        Mat raw;
        try {
            raw = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_UNCHANGED);
        } catch (CvException e) {
            throw new ImageDecodeException("Failed to load " + label + ": " + e.getMessage(), e);
        } finally {
            buffer.release();
        }

        if (raw == null || raw.empty()) {
            throw new ImageDecodeException("Failed to load " + label + ": unrecognised or corrupt image data");
        }

        // 16 位 PNG/TIFF 降到 8 位
        int depth = raw.depth();
        if (depth == CvType.CV_16U) {
            Mat eight = new Mat();
            raw.convertTo(eight, CvType.CV_8U, 1.0 / 257.0);
            raw.release();
            return eight;
        }
        if (depth != CvType.CV_8U) {
            raw.release();
            throw new ImageDecodeException("Failed to load " + label + ": unsupported pixel depth " + depth);
        }
        return raw;
    }
}
