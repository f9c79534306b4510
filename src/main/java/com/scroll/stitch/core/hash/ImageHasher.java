package com.scroll.stitch.core.hash;

import com.scroll.stitch.core.image.ImageCodec;
import com.scroll.stitch.core.image.ImageDecodeException;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * 整图感知哈希计算器
 * <p>
 * 功能：把一张图压缩成 64 位指纹，用汉明距离做近似比较
 * <p>
 * 约定：
 * 1. 位序按行优先，bit i 对应第 i 个比较结果
 * 2. 只有同一算法、同一 size 得到的指纹才可比较
 * 3. 无状态，可在多线程间共享
 */
public class ImageHasher {
    private static final Logger logger = LoggerFactory.getLogger(ImageHasher.class);

    public static final int DEFAULT_HASH_SIZE = 8;

    // pHash 固定先缩放到 32x32 再做 DCT
    private static final int DCT_GRID = 32;
    private static final int MAX_BITS = 64;

    // 32x32 网格上的余弦基，COS_TABLE[k][x] = cos((2x+1)kπ / 64)
    private static final double[][] COS_TABLE = buildCosTable();

    /**
     * 按算法标签计算哈希
     */
    public long hash(byte[] imageBytes, HashAlgorithm algorithm, int hashSize) {
        switch (algorithm) {
            case DHASH:
                return differenceHash(imageBytes, hashSize);
            case AHASH:
                return averageHash(imageBytes, hashSize);
            case PHASH:
                return perceptualHash(imageBytes, hashSize);
            default:
                throw new IllegalArgumentException("Unknown hash method: " + algorithm);
        }
    }

    /**
     * 差值哈希 (dHash)
     * <p>
     * 灰度 → 缩放到 (size+1) x size → 左像素 < 右像素 时置位
     */
    public long differenceHash(byte[] imageBytes, int hashSize) {
        requireBitSize(hashSize);
        Mat gray = ImageCodec.decodeGray(imageBytes);
        try {
            return differenceHash(gray, hashSize);
        } finally {
            gray.release();
        }
    }

    long differenceHash(Mat gray, int hashSize) {
        int[] pixels = resizeToPixels(gray, hashSize + 1, hashSize, Imgproc.INTER_AREA);
        int stride = hashSize + 1;

        long hash = 0L;
        int bit = 0;
        for (int y = 0; y < hashSize; y++) {
            for (int x = 0; x < hashSize; x++) {
                int left = pixels[y * stride + x];
                int right = pixels[y * stride + x + 1];
                if (left < right) {
                    hash |= 1L << bit;
                }
                bit++;
            }
        }
        return hash;
    }

    /**
     * 平均哈希 (aHash)
     * <p>
     * 灰度 → 缩放到 size x size → 像素 >= 均值（整数下取整）时置位
     */
    public long averageHash(byte[] imageBytes, int hashSize) {
        requireBitSize(hashSize);
        Mat gray = ImageCodec.decodeGray(imageBytes);
        try {
            return averageHash(gray, hashSize);
        } finally {
            gray.release();
        }
    }

    long averageHash(Mat gray, int hashSize) {
        int[] pixels = resizeToPixels(gray, hashSize, hashSize, Imgproc.INTER_AREA);

        long sum = 0;
        for (int p : pixels) {
            sum += p;
        }
        long mean = sum / pixels.length;

        long hash = 0L;
        for (int i = 0; i < pixels.length; i++) {
            if (pixels[i] >= mean) {
                hash |= 1L << i;
            }
        }
        return hash;
    }

    /**
     * 感知哈希 (pHash)
     * <p>
     * 灰度 → 缩放到 32x32 → 取 size x size 的 DCT-II 低频系数 →
     * 中位数（不含 DC）为阈值，跳过 DC 按行优先置位，最多 64 位
     */
    public long perceptualHash(byte[] imageBytes, int hashSize) {
        if (hashSize < 2 || hashSize > DCT_GRID) {
            throw new IllegalArgumentException("pHash size must be in [2, " + DCT_GRID + "], got " + hashSize);
        }
        Mat gray = ImageCodec.decodeGray(imageBytes);
        try {
            return perceptualHash(gray, hashSize);
        } finally {
            gray.release();
        }
    }

    long perceptualHash(Mat gray, int hashSize) {
        int[] pixels = resizeToPixels(gray, DCT_GRID, DCT_GRID, Imgproc.INTER_LANCZOS4);
        double[] coeffs = lowFrequencyDct(pixels, hashSize);

        // 排除 DC 分量后取中位数（偶数个时取上中位数）
        double[] acTerms = Arrays.copyOfRange(coeffs, 1, coeffs.length);
        double[] sorted = acTerms.clone();
        Arrays.sort(sorted);
        double median = sorted[sorted.length / 2];

        long hash = 0L;
        int bits = Math.min(acTerms.length, MAX_BITS);
        for (int i = 0; i < bits; i++) {
            if (acTerms[i] > median) {
                hash |= 1L << i;
            }
        }
        return hash;
    }

    /**
     * 直接按余弦基求和的 DCT-II，只算左上角 size x size 低频块
     */
    private double[] lowFrequencyDct(int[] pixels, int size) {
        double[] coeffs = new double[size * size];
        double invSqrt2 = 1.0 / Math.sqrt(2.0);
        double scale = 2.0 / (DCT_GRID * DCT_GRID);

        for (int v = 0; v < size; v++) {
            for (int u = 0; u < size; u++) {
                double sum = 0.0;
                for (int y = 0; y < DCT_GRID; y++) {
                    double cosV = COS_TABLE[v][y];
                    int rowOffset = y * DCT_GRID;
                    for (int x = 0; x < DCT_GRID; x++) {
                        sum += pixels[rowOffset + x] * COS_TABLE[u][x] * cosV;
                    }
                }
                double cu = u == 0 ? invSqrt2 : 1.0;
                double cv = v == 0 ? invSqrt2 : 1.0;
                coeffs[v * size + u] = sum * cu * cv * scale;
            }
        }
        return coeffs;
    }

    /**
     * 汉明距离：两个指纹不同的位数
     */
    public static int hammingDistance(long a, long b) {
        return Long.bitCount(a ^ b);
    }

    /**
     * 相似度 = 1 - 距离 / (size*size)，1.0 表示完全相同
     */
    public static double similarity(long a, long b, int hashSize) {
        if (hashSize <= 0) {
            throw new IllegalArgumentException("Hash size must be positive, got " + hashSize);
        }
        double maxDistance = (double) hashSize * hashSize;
        return 1.0 - hammingDistance(a, b) / maxDistance;
    }

    /**
     * 批量并行计算
     * <p>
     * 每张图独立解码、独立写入自己的结果槽位，输出顺序与输入一致。
     *
     * @param policy STRICT：有失败则抛出下标最小的 {@link ImageDecodeException}；
     *               LENIENT：失败项返回 success=false 的占位结果
     */
    public List<HashOutcome> batchHash(List<byte[]> images, HashAlgorithm algorithm, int hashSize,
                                       BatchHashPolicy policy) {
        if (images == null || images.isEmpty()) {
            return new ArrayList<>();
        }
        validateSize(algorithm, hashSize);

        HashOutcome[] outcomes = new HashOutcome[images.size()];
        IntStream.range(0, images.size()).parallel().forEach(i -> {
            try {
                outcomes[i] = HashOutcome.success(i, hash(images.get(i), algorithm, hashSize));
            } catch (ImageDecodeException e) {
                outcomes[i] = HashOutcome.failure(i, e.getMessage());
            }
        });

        List<HashOutcome> result = Arrays.asList(outcomes);
        List<HashOutcome> failures = result.stream().filter(o -> !o.isSuccess()).toList();

        if (!failures.isEmpty()) {
            if (policy == BatchHashPolicy.STRICT) {
                HashOutcome first = failures.get(0);
                throw new ImageDecodeException("Image " + first.getIndex() + ": " + first.getError());
            }
            logger.warn("Batch {} hash: {} of {} images failed, placeholder hash {} substituted at {}",
                    algorithm.getTag(), failures.size(), images.size(), HashOutcome.PLACEHOLDER_HASH,
                    failures.stream().map(HashOutcome::getIndex).toList());
        }

        logger.debug("Batch {} hash finished: {} images", algorithm.getTag(), images.size());
        return new ArrayList<>(result);
    }

    private void validateSize(HashAlgorithm algorithm, int hashSize) {
        if (algorithm == HashAlgorithm.PHASH) {
            if (hashSize < 2 || hashSize > DCT_GRID) {
                throw new IllegalArgumentException("pHash size must be in [2, " + DCT_GRID + "], got " + hashSize);
            }
        } else {
            requireBitSize(hashSize);
        }
    }

    // dHash/aHash 的位数为 size*size，必须放得进 64 位
    private static void requireBitSize(int hashSize) {
        if (hashSize < 1 || hashSize * hashSize > MAX_BITS) {
            throw new IllegalArgumentException("Hash size must be in [1, 8], got " + hashSize);
        }
    }

    private static int[] resizeToPixels(Mat gray, int width, int height, int interpolation) {
        Mat resized = new Mat();
        try {
            Imgproc.resize(gray, resized, new Size(width, height), 0, 0, interpolation);
            byte[] raw = new byte[width * height];
            resized.get(0, 0, raw);
            int[] pixels = new int[raw.length];
            for (int i = 0; i < raw.length; i++) {
                pixels[i] = raw[i] & 0xFF;
            }
            return pixels;
        } finally {
            resized.release();
        }
    }

    private static double[][] buildCosTable() {
        double[][] table = new double[DCT_GRID][DCT_GRID];
        for (int k = 0; k < DCT_GRID; k++) {
            for (int x = 0; x < DCT_GRID; x++) {
                table[k][x] = Math.cos((2 * x + 1) * k * Math.PI / (2.0 * DCT_GRID));
            }
        }
        return table;
    }
}
