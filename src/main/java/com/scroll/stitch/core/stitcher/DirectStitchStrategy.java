package com.scroll.stitch.core.stitcher;

import com.scroll.stitch.core.hash.RowHasher;
import com.scroll.stitch.core.matcher.OverlapRun;
import com.scroll.stitch.core.matcher.SequenceMatcher;

/**
 * 直接拼接：底部窗口内的单一最长公共区间即为接缝
 * <p>
 * 适用于内容不重复的常规滚动截图；找不到足够长的重叠时直接上下拼接。
 */
public class DirectStitchStrategy extends RowHashStitchStrategy {
    public static final String NAME = "direct";

    public DirectStitchStrategy() {
        this(new RowHasher(), new SequenceMatcher(), RowHasher.DEFAULT_IGNORE_RIGHT_PIXELS,
                SequenceMatcher.DEFAULT_MIN_RATIO);
    }

    public DirectStitchStrategy(RowHasher rowHasher, SequenceMatcher matcher,
                                int ignoreRightPixels, double minOverlapRatio) {
        super(rowHasher, matcher, ignoreRightPixels, minOverlapRatio);
    }

    @Override
    protected SeamDecision chooseSeam(long[] searchRegion, long[] lowerHashes, int searchStart, int upperHeight) {
        OverlapRun run = matcher.findLongestRun(searchRegion, lowerHashes, minOverlapRatio);
        return SeamDecision.of(run.shiftSeq1(searchStart));
    }

    @Override
    public String getName() {
        return NAME;
    }
}
