package com.scroll.stitch.core.stitcher;

import com.scroll.stitch.core.hash.RowHasher;
import com.scroll.stitch.core.matcher.OverlapRun;
import com.scroll.stitch.core.matcher.SequenceMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 智能拼接：多候选纠错
 * <p>
 * 与直接拼接的区别：
 * 1. 取前 topK 个互不显著重叠的候选区间，而不是只取最长的
 * 2. 按长度从长到短，采用第一个不会让结果比 image1 更矮的候选
 * 3. 全部候选都会变矮时，仍采用最长的那个（不报错），并标记 shrunk
 * <p>
 * 解决"最长匹配落在重复内容上、位置错误"的问题。
 */
public class SmartStitchStrategy extends RowHashStitchStrategy {
    private static final Logger logger = LoggerFactory.getLogger(SmartStitchStrategy.class);

    public static final String NAME = "smart";
    public static final double DEFAULT_MIN_OVERLAP_RATIO = 0.01;

    private final int topK;

    public SmartStitchStrategy() {
        this(new RowHasher(), new SequenceMatcher(), RowHasher.DEFAULT_IGNORE_RIGHT_PIXELS,
                DEFAULT_MIN_OVERLAP_RATIO, SequenceMatcher.DEFAULT_TOP_K);
    }

    public SmartStitchStrategy(RowHasher rowHasher, SequenceMatcher matcher,
                               int ignoreRightPixels, double minOverlapRatio, int topK) {
        super(rowHasher, matcher, ignoreRightPixels, minOverlapRatio);
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1, got " + topK);
        }
        this.topK = topK;
    }

    @Override
    protected SeamDecision chooseSeam(long[] searchRegion, long[] lowerHashes, int searchStart, int upperHeight) {
        List<OverlapRun> runs = matcher.findTopRuns(searchRegion, lowerHashes, minOverlapRatio, topK);
        if (runs.isEmpty()) {
            return SeamDecision.of(OverlapRun.NONE);
        }
        logger.debug("[smart] {} candidate runs", runs.size());

        List<CandidateEvaluation> evaluations = new ArrayList<>();
        int acceptedIndex = -1;
        for (OverlapRun relative : runs) {
            OverlapRun run = relative.shiftSeq1(searchStart);
            int predicted = compositeHeight(run, upperHeight, lowerHashes.length);
            boolean shrinks = predicted < upperHeight;
            evaluations.add(new CandidateEvaluation(run, predicted, shrinks, false));
            logger.debug("[smart] Candidate #{}: {} -> {} rows ({})",
                    evaluations.size(), run, predicted, shrinks ? "shrinks" : "grows");
            if (!shrinks) {
                acceptedIndex = evaluations.size() - 1;
                break;
            }
        }

        boolean shrunk = false;
        if (acceptedIndex < 0) {
            // 全部候选都会变矮，仍用最长的
            acceptedIndex = 0;
            shrunk = true;
            logger.warn("[smart] All {} candidates shrink the result below {} rows, using the longest {}",
                    evaluations.size(), upperHeight, evaluations.get(0).getRun());
        }
        CandidateEvaluation accepted = evaluations.get(acceptedIndex).markAccepted();
        evaluations.set(acceptedIndex, accepted);

        return new SeamDecision(accepted.getRun(), shrunk, evaluations);
    }

    public int getTopK() {
        return topK;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
