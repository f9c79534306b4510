package com.scroll.stitch.core.hash;

import com.scroll.stitch.core.image.ImageCodec;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * 逐行指纹 - 专为滚动长截图对齐设计
 * <p>
 * 每一行：
 * 1. 在有效宽度内对 R/G/B 分别求均值（整数下取整）
 * 2. 均值向下量化到 8 的倍数，吸收 ±7 的压缩噪声
 * 3. hash = r*K1 + g*K2 + b*K3（long 自然溢出即模 2^64）
 * <p>
 * 右侧 ignoreRightPixels 像素不参与计算，用来排除滚动条。
 */
public class RowHasher {
    private static final Logger logger = LoggerFactory.getLogger(RowHasher.class);

    public static final int DEFAULT_IGNORE_RIGHT_PIXELS = 20;

    static final long K_RED = 73856093L;
    static final long K_GREEN = 19349663L;
    static final long K_BLUE = 83492791L;

    private static final int QUANT_STEP = 8;
    private static final int CHANNELS = 4;

    /**
     * 从编码后的图像字节计算行指纹
     */
    public long[] rowFingerprints(byte[] imageBytes, int ignoreRightPixels) {
        Mat bgra = ImageCodec.decodeBgra(imageBytes);
        try {
            return rowFingerprints(bgra, ignoreRightPixels);
        } finally {
            bgra.release();
        }
    }

    /**
     * 从已解码的 BGRA (CV_8UC4) 图像计算行指纹，长度 == 行数，顺序自上而下
     */
    public long[] rowFingerprints(Mat bgra, int ignoreRightPixels) {
        if (bgra.type() != CvType.CV_8UC4) {
            throw new IllegalArgumentException("Row fingerprints need a CV_8UC4 image, got type " + bgra.type());
        }
        int width = bgra.cols();
        int height = bgra.rows();
        int effectiveWidth = effectiveWidth(width, ignoreRightPixels);

        // 逐行读取：长截图的总字节数可能超出 int 下标范围
        long[] hashes = new long[height];
        IntStream.range(0, height).parallel()
                .forEach(y -> hashes[y] = rowFingerprint(bgra, y, effectiveWidth));

        if (logger.isTraceEnabled()) {
            logger.trace("Row fingerprints {}x{} (effective width {}), first rows: {}",
                    width, height, effectiveWidth,
                    Arrays.toString(Arrays.copyOf(hashes, Math.min(3, hashes.length))));
        }
        return hashes;
    }

    /**
     * 有效宽度：只有 0 < ignore < width 时才扣除，否则用整行
     */
    static int effectiveWidth(int width, int ignoreRightPixels) {
        if (ignoreRightPixels > 0 && ignoreRightPixels < width) {
            return width - ignoreRightPixels;
        }
        return width;
    }

    /**
     * 由量化后的通道均值组合出行指纹
     */
    static long mix(long red, long green, long blue) {
        return red * K_RED + green * K_GREEN + blue * K_BLUE;
    }

    static long quantize(long mean) {
        return (mean / QUANT_STEP) * QUANT_STEP;
    }

    // BGRA 排列：offset+0=B, +1=G, +2=R
    private static long rowFingerprint(Mat bgra, int y, int effectiveWidth) {
        if (effectiveWidth <= 0) {
            return 0L;
        }
        byte[] row = new byte[effectiveWidth * CHANNELS];
        bgra.get(y, 0, row);

        long rSum = 0;
        long gSum = 0;
        long bSum = 0;
        for (int i = 0; i < row.length; i += CHANNELS) {
            bSum += row[i] & 0xFF;
            gSum += row[i + 1] & 0xFF;
            rSum += row[i + 2] & 0xFF;
        }
        return mix(quantize(rSum / effectiveWidth), quantize(gSum / effectiveWidth), quantize(bSum / effectiveWidth));
    }
}
