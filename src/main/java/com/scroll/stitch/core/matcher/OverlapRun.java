package com.scroll.stitch.core.matcher;

import java.util.Objects;

/**
 * 两个指纹序列中的一段连续相同区间
 * <p>
 * seq1[startInSeq1, startInSeq1+length) == seq2[startInSeq2, startInSeq2+length)
 * <p>
 * {@link #NONE} 表示没有达到阈值的重叠。
 */
public final class OverlapRun {
    public static final OverlapRun NONE = new OverlapRun(-1, -1, 0);

    private final int startInSeq1;
    private final int startInSeq2;
    private final int length;

    public OverlapRun(int startInSeq1, int startInSeq2, int length) {
        this.startInSeq1 = startInSeq1;
        this.startInSeq2 = startInSeq2;
        this.length = length;
    }

    public int getStartInSeq1() { return startInSeq1; }
    public int getStartInSeq2() { return startInSeq2; }
    public int getLength() { return length; }

    public int getEndInSeq1() { return startInSeq1 + length; }
    public int getEndInSeq2() { return startInSeq2 + length; }

    public boolean isFound() {
        return length > 0 && startInSeq1 >= 0 && startInSeq2 >= 0;
    }

    /**
     * 把 seq1 上的相对下标平移到绝对位置（搜索窗口不从 0 开始时使用）
     */
    public OverlapRun shiftSeq1(int offset) {
        if (!isFound()) {
            return this;
        }
        return new OverlapRun(startInSeq1 + offset, startInSeq2, length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OverlapRun)) return false;
        OverlapRun that = (OverlapRun) o;
        return startInSeq1 == that.startInSeq1 && startInSeq2 == that.startInSeq2 && length == that.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startInSeq1, startInSeq2, length);
    }

    @Override
    public String toString() {
        return isFound()
                ? "OverlapRun{seq1[" + startInSeq1 + ":" + getEndInSeq1() + "] = seq2[" + startInSeq2 + ":" + getEndInSeq2() + "]}"
                : "OverlapRun{NONE}";
    }
}
