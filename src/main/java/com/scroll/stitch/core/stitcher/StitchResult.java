package com.scroll.stitch.core.stitcher;

import com.scroll.stitch.core.matcher.OverlapRun;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 拼接结果
 * <p>
 * success=false 时只有 message 有意义，不会带部分图像。
 * overlapFound=false 且 success=true 表示没找到重叠，结果是直接上下拼接。
 */
public class StitchResult {
    private final boolean success;
    private final String message;
    private final String strategy;

    // PNG 字节流
    private final byte[] image;
    private final int width;
    private final int height;

    // 宽度对齐后的 image1 高度
    private final int image1Height;
    private final int image2Height;
    // image1 中开始搜索重叠的行（只搜底部 image2 高度那么多行）
    private final int searchStart;

    private final boolean overlapFound;
    // image1 上为绝对行号
    private final OverlapRun overlap;
    private final int keptFromImage1;
    private final int skippedFromImage2;
    // 所有候选都会变矮、只能退而采用最长候选
    private final boolean shrunk;
    private final List<CandidateEvaluation> candidates;

    private StitchResult(Builder builder) {
        this.success = builder.success;
        this.message = builder.message;
        this.strategy = builder.strategy;
        this.image = builder.image;
        this.width = builder.width;
        this.height = builder.height;
        this.image1Height = builder.image1Height;
        this.image2Height = builder.image2Height;
        this.searchStart = builder.searchStart;
        this.overlapFound = builder.overlapFound;
        this.overlap = builder.overlap;
        this.keptFromImage1 = builder.keptFromImage1;
        this.skippedFromImage2 = builder.skippedFromImage2;
        this.shrunk = builder.shrunk;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(builder.candidates));
    }

    public static StitchResult failure(String strategy, String message) {
        return new Builder().success(false).strategy(strategy).message(message).build();
    }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }
    public String getStrategy() { return strategy; }
    public byte[] getImage() { return image; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getImage1Height() { return image1Height; }
    public int getImage2Height() { return image2Height; }
    public int getSearchStart() { return searchStart; }
    public boolean isOverlapFound() { return overlapFound; }
    public OverlapRun getOverlap() { return overlap; }
    public int getKeptFromImage1() { return keptFromImage1; }
    public int getSkippedFromImage2() { return skippedFromImage2; }
    public boolean isShrunk() { return shrunk; }
    public List<CandidateEvaluation> getCandidates() { return candidates; }

    @Override
    public String toString() {
        if (!success) {
            return "StitchResult{failed, message='" + message + "'}";
        }
        return "StitchResult{" + strategy +
                ", " + width + "x" + height +
                ", overlap=" + overlap +
                ", kept1=" + keptFromImage1 +
                ", skipped2=" + skippedFromImage2 +
                ", shrunk=" + shrunk + '}';
    }

    public static class Builder {
        private boolean success = true;
        private String message;
        private String strategy;
        private byte[] image;
        private int width;
        private int height;
        private int image1Height;
        private int image2Height;
        private int searchStart;
        private boolean overlapFound;
        private OverlapRun overlap = OverlapRun.NONE;
        private int keptFromImage1;
        private int skippedFromImage2;
        private boolean shrunk;
        private List<CandidateEvaluation> candidates = new ArrayList<>();

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder strategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder image(byte[] image, int width, int height) {
            this.image = image;
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder sourceHeights(int image1Height, int image2Height) {
            this.image1Height = image1Height;
            this.image2Height = image2Height;
            return this;
        }

        public Builder searchStart(int searchStart) {
            this.searchStart = searchStart;
            return this;
        }

        public Builder overlap(OverlapRun overlap) {
            this.overlap = overlap;
            this.overlapFound = overlap.isFound();
            return this;
        }

        public Builder seam(int keptFromImage1, int skippedFromImage2) {
            this.keptFromImage1 = keptFromImage1;
            this.skippedFromImage2 = skippedFromImage2;
            return this;
        }

        public Builder shrunk(boolean shrunk) {
            this.shrunk = shrunk;
            return this;
        }

        public Builder candidates(List<CandidateEvaluation> candidates) {
            this.candidates = candidates;
            return this;
        }

        public StitchResult build() {
            return new StitchResult(this);
        }
    }
}
