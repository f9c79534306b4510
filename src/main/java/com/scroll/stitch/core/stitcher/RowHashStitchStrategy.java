package com.scroll.stitch.core.stitcher;

import com.scroll.stitch.core.hash.RowHasher;
import com.scroll.stitch.core.image.ImageCodec;
import com.scroll.stitch.core.image.ImageDecodeException;
import com.scroll.stitch.core.image.ImageEncodeException;
import com.scroll.stitch.core.matcher.OverlapRun;
import com.scroll.stitch.core.matcher.SequenceMatcher;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 基于逐行指纹的竖直拼接骨架
 * <p>
 * 流程：
 * 1. 解码两张图；宽度不同时把 image1 按比例缩放到 image2 的宽度（image2 为准）
 * 2. 用相同的 ignoreRightPixels 计算两张图的行指纹
 * 3. 只在 image1 底部、长度等于 image2 行数的窗口里找重叠
 * 4. 由子类决定采用哪段重叠（{@link #chooseSeam}）
 * 5. 保留 image1 [0, a+L) 行，跳过 image2 [0, b+L) 行，其余追加，接缝处不做融合
 * 6. 编码为 PNG
 * <p>
 * 没有重叠时直接把 image2 整张接在 image1 下面。
 */
public abstract class RowHashStitchStrategy implements StitchStrategy {
    private static final Logger logger = LoggerFactory.getLogger(RowHashStitchStrategy.class);

    protected final RowHasher rowHasher;
    protected final SequenceMatcher matcher;
    protected final int ignoreRightPixels;
    protected final double minOverlapRatio;

    protected RowHashStitchStrategy(RowHasher rowHasher, SequenceMatcher matcher,
                                    int ignoreRightPixels, double minOverlapRatio) {
        if (ignoreRightPixels < 0) {
            throw new IllegalArgumentException("ignoreRightPixels must not be negative, got " + ignoreRightPixels);
        }
        if (Double.isNaN(minOverlapRatio) || minOverlapRatio < 0.0 || minOverlapRatio > 1.0) {
            throw new IllegalArgumentException("minOverlapRatio must be in [0, 1], got " + minOverlapRatio);
        }
        this.rowHasher = rowHasher;
        this.matcher = matcher;
        this.ignoreRightPixels = ignoreRightPixels;
        this.minOverlapRatio = minOverlapRatio;
    }

    /**
     * 从候选中选出接缝
     *
     * @param searchRegion image1 底部窗口的行指纹
     * @param lowerHashes  image2 全部行指纹
     * @param searchStart  窗口在 image1 中的起始行
     * @param upperHeight  对齐后 image1 的行数
     * @return 采用的重叠（image1 上为绝对行号）及评估明细
     */
    protected abstract SeamDecision chooseSeam(long[] searchRegion, long[] lowerHashes,
                                               int searchStart, int upperHeight);

    @Override
    public final StitchResult stitch(byte[] upper, byte[] lower) {
        Mat img1 = null;
        Mat img2 = null;
        Mat result = null;
        try {
            img1 = ImageCodec.decodeBgra(upper, "image 1");
            img2 = ImageCodec.decodeBgra(lower, "image 2");
            logger.debug("[{}] Processing images: ({}, {}) + ({}, {})",
                    getName(), img1.cols(), img1.rows(), img2.cols(), img2.rows());

            img1 = alignWidth(img1, img2.cols());

            long[] upperHashes = rowHasher.rowFingerprints(img1, ignoreRightPixels);
            long[] lowerHashes = rowHasher.rowFingerprints(img2, ignoreRightPixels);

            int height1 = upperHashes.length;
            int height2 = lowerHashes.length;
            int searchStart = Math.max(0, height1 - height2);
            long[] searchRegion = Arrays.copyOfRange(upperHashes, searchStart, height1);
            logger.debug("[{}] Search window: image1[{}:{}] (bottom {} rows), image2 {} rows, ignore right {} px",
                    getName(), searchStart, height1, searchRegion.length, height2, ignoreRightPixels);

            SeamDecision decision = chooseSeam(searchRegion, lowerHashes, searchStart, height1);
            OverlapRun seam = decision.getOverlap();

            int keep1 = keptFromUpper(seam, height1);
            int skip2 = skippedFromLower(seam);
            int keep2 = Math.max(0, height2 - skip2);
            int resultHeight = keep1 + keep2;

            if (seam.isFound()) {
                logger.debug("[{}] Seam: image1[{}:{}] = image2[{}:{}], keep {} + {} = {} rows",
                        getName(), seam.getStartInSeq1(), seam.getEndInSeq1(),
                        seam.getStartInSeq2(), seam.getEndInSeq2(), keep1, keep2, resultHeight);
            } else {
                logger.debug("[{}] No overlap found, concatenating {} + {} rows", getName(), height1, height2);
            }

            result = composite(img1, keep1, img2, skip2, keep2);
            byte[] png = ImageCodec.encodePng(result);

            return new StitchResult.Builder()
                    .strategy(getName())
                    .image(png, result.cols(), result.rows())
                    .sourceHeights(height1, height2)
                    .searchStart(searchStart)
                    .overlap(seam)
                    .seam(keep1, skip2)
                    .shrunk(decision.isShrunk())
                    .candidates(decision.getCandidates())
                    .message(seam.isFound() ? "Stitched" : "No overlap found, images concatenated")
                    .build();
        } catch (ImageDecodeException | ImageEncodeException e) {
            logger.warn("[{}] Stitch failed: {}", getName(), e.getMessage());
            return StitchResult.failure(getName(), e.getMessage());
        } finally {
            if (img1 != null) img1.release();
            if (img2 != null) img2.release();
            if (result != null) result.release();
        }
    }

    /**
     * 采用某段重叠时的结果高度：(a+L) + max(0, h2 - (b+L))；无重叠时 h1 + h2
     */
    protected static int compositeHeight(OverlapRun seam, int height1, int height2) {
        return keptFromUpper(seam, height1) + Math.max(0, height2 - skippedFromLower(seam));
    }

    private static int keptFromUpper(OverlapRun seam, int height1) {
        return seam.isFound() ? seam.getEndInSeq1() : height1;
    }

    private static int skippedFromLower(OverlapRun seam) {
        return seam.isFound() ? seam.getEndInSeq2() : 0;
    }

    /**
     * image1 缩放到目标宽度，高度按比例（向下取整），Lanczos 插值
     */
    private Mat alignWidth(Mat img1, int targetWidth) {
        if (img1.cols() == targetWidth) {
            return img1;
        }
        int newHeight = Math.max(1, (int) ((double) img1.rows() * targetWidth / img1.cols()));
        logger.debug("[{}] Resizing image 1 width: {} -> {} (height {} -> {})",
                getName(), img1.cols(), targetWidth, img1.rows(), newHeight);

        Mat resized = new Mat();
        Imgproc.resize(img1, resized, new Size(targetWidth, newHeight), 0, 0, Imgproc.INTER_LANCZOS4);
        img1.release();
        return resized;
    }

    /**
     * 逐行原样拷贝：image1 前 keep1 行 + image2 从 skip2 开始的 keep2 行
     */
    private Mat composite(Mat img1, int keep1, Mat img2, int skip2, int keep2) {
        int width = img2.cols();
        Mat result = new Mat(keep1 + keep2, width, CvType.CV_8UC4);

        Mat upperSrc = img1.rowRange(0, keep1);
        Mat upperDst = result.rowRange(0, keep1);
        upperSrc.copyTo(upperDst);
        upperSrc.release();
        upperDst.release();

        if (keep2 > 0) {
            Mat lowerSrc = img2.rowRange(skip2, skip2 + keep2);
            Mat lowerDst = result.rowRange(keep1, keep1 + keep2);
            lowerSrc.copyTo(lowerDst);
            lowerSrc.release();
            lowerDst.release();
        }
        return result;
    }

    /**
     * 子类选出的接缝
     */
    protected static class SeamDecision {
        private final OverlapRun overlap;
        private final boolean shrunk;
        private final List<CandidateEvaluation> candidates;

        protected SeamDecision(OverlapRun overlap, boolean shrunk, List<CandidateEvaluation> candidates) {
            this.overlap = overlap;
            this.shrunk = shrunk;
            this.candidates = candidates;
        }

        protected static SeamDecision of(OverlapRun overlap) {
            return new SeamDecision(overlap, false, new ArrayList<>());
        }

        public OverlapRun getOverlap() { return overlap; }
        public boolean isShrunk() { return shrunk; }
        public List<CandidateEvaluation> getCandidates() { return candidates; }
    }
}
