package com.scroll.stitch.support;

import com.scroll.stitch.core.image.ImageCodec;
import com.scroll.stitch.core.image.OpenCvLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;

/**
 * 测试用合成截图
 * <p>
 * 每行纯色，颜色由 (行号, 蓝色通道) 决定：r = (y*8) % 256，g = ((y/32)*8) % 256，b 固定。
 * 所有通道都是 8 的倍数，量化后不变，同一 blue 值下 1024 行以内各行指纹互不相同。
 */
public final class TestImages {

    static {
        OpenCvLoader.ensureLoaded();
    }

    private TestImages() {
    }

    public static Strip strip(int width) {
        return new Strip(width);
    }

    /**
     * 第 y 行的 {r, g, b}
     */
    public static int[] color(int y, int blue) {
        return new int[]{(y * 8) % 256, ((y / 32) * 8) % 256, blue};
    }

    /**
     * 解码 PNG 并读取 (x, y) 处的 {r, g, b}
     */
    public static int[] pixelAt(byte[] png, int x, int y) {
        Mat bgra = ImageCodec.decodeBgra(png);
        try {
            double[] px = bgra.get(y, x);
            return new int[]{(int) px[2], (int) px[1], (int) px[0]};
        } finally {
            bgra.release();
        }
    }

    /**
     * 水平灰度渐变，第 x 列灰度为 2x（width 不超过 128）
     */
    public static byte[] horizontalGradient(int width, int height, boolean mirrored) {
        byte[] data = new byte[width * height * 4];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int value = 2 * (mirrored ? width - 1 - x : x);
                int offset = (y * width + x) * 4;
                data[offset] = (byte) value;
                data[offset + 1] = (byte) value;
                data[offset + 2] = (byte) value;
                data[offset + 3] = (byte) 255;
            }
        }
        return encode(data, width, height);
    }

    public static byte[] solid(int width, int height, int r, int g, int b) {
        return strip(width).uniform(height, r, g, b).toPng();
    }

    /**
     * 重新编码一遍（解码后再无损编码）
     */
    public static byte[] reencode(byte[] png) {
        Mat bgra = ImageCodec.decodeBgra(png);
        try {
            return ImageCodec.encodePng(bgra);
        } finally {
            bgra.release();
        }
    }

    public static byte[] garbage() {
        return new byte[]{0x13, 0x37, 0x00, 0x42, 0x7f, 0x10, 0x20, 0x30, 0x40, 0x50};
    }

    private static byte[] encode(byte[] bgra, int width, int height) {
        Mat mat = new Mat(height, width, CvType.CV_8UC4);
        try {
            mat.put(0, 0, bgra);
            return ImageCodec.encodePng(mat);
        } finally {
            mat.release();
        }
    }

    /**
     * 逐段追加行的合成截图
     */
    public static final class Strip {
        private final int width;
        private final List<int[]> rows = new ArrayList<>();
        private int scrollbarWidth;
        private int scrollbarShade;

        private Strip(int width) {
            this.width = width;
        }

        public Strip block(int count, int blue) {
            return block(count, blue, 0);
        }

        /**
         * 追加 count 行，颜色取 {@link #color}(offset + i, blue)
         */
        public Strip block(int count, int blue, int offset) {
            for (int i = 0; i < count; i++) {
                rows.add(color(offset + i, blue));
            }
            return this;
        }

        public Strip uniform(int count, int r, int g, int b) {
            for (int i = 0; i < count; i++) {
                rows.add(new int[]{r, g, b});
            }
            return this;
        }

        /**
         * 右侧 barWidth 像素画成单一灰度（模拟滚动条）
         */
        public Strip scrollbar(int barWidth, int shade) {
            this.scrollbarWidth = barWidth;
            this.scrollbarShade = shade;
            return this;
        }

        public int height() {
            return rows.size();
        }

        public byte[] toPng() {
            int height = rows.size();
            byte[] data = new byte[width * height * 4];
            for (int y = 0; y < height; y++) {
                int[] rgb = rows.get(y);
                for (int x = 0; x < width; x++) {
                    boolean bar = x >= width - scrollbarWidth;
                    int offset = (y * width + x) * 4;
                    data[offset] = (byte) (bar ? scrollbarShade : rgb[2]);
                    data[offset + 1] = (byte) (bar ? scrollbarShade : rgb[1]);
                    data[offset + 2] = (byte) (bar ? scrollbarShade : rgb[0]);
                    data[offset + 3] = (byte) 255;
                }
            }
            return encode(data, width, height);
        }
    }
}
