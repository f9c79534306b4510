package com.scroll.stitch.core.stitcher;

import com.scroll.stitch.core.matcher.OverlapRun;

/**
 * 智能拼接时对单个候选区间的评估
 */
public class CandidateEvaluation {
    // image1 上为绝对行号
    private final OverlapRun run;
    private final int predictedHeight;
    private final boolean shrinks;
    private final boolean accepted;

    public CandidateEvaluation(OverlapRun run, int predictedHeight, boolean shrinks, boolean accepted) {
        this.run = run;
        this.predictedHeight = predictedHeight;
        this.shrinks = shrinks;
        this.accepted = accepted;
    }

    CandidateEvaluation markAccepted() {
        return new CandidateEvaluation(run, predictedHeight, shrinks, true);
    }

    public OverlapRun getRun() { return run; }
    public int getPredictedHeight() { return predictedHeight; }
    public boolean isShrinks() { return shrinks; }
    public boolean isAccepted() { return accepted; }

    @Override
    public String toString() {
        return "CandidateEvaluation{" + run +
                ", predictedHeight=" + predictedHeight +
                ", shrinks=" + shrinks +
                ", accepted=" + accepted + '}';
    }
}
