package com.scroll.stitch.core.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 指纹序列最长公共连续区间（最长公共子串）搜索
 * <p>
 * 两种用法：
 * - {@link #findLongestRun}：经典 O(m·n) 动态规划，只返回最长的一段
 * - {@link #findTopRuns}：从公共值出发向后扩展，返回最多 topK 段互不显著重叠的候选，供纠错拼接使用
 * <p>
 * 最小长度阈值 minLength = max(1, floor(min(m, n) * minRatio))。
 */
public class SequenceMatcher {
    private static final Logger logger = LoggerFactory.getLogger(SequenceMatcher.class);

    public static final double DEFAULT_MIN_RATIO = 0.1;
    public static final int DEFAULT_TOP_K = 5;

    // 超过这个配对数说明输入里有大片重复值（如纯色区域），扩展会退化成二次方
    private static final long PAIR_WARN_THRESHOLD = 4_000_000L;

    /**
     * 单一最长区间
     * <p>
     * dp[i][j] = seq1[i-1]==seq2[j-1] ? dp[i-1][j-1]+1 : 0。
     * 按 i 升序、j 升序扫描，只有严格更长时才更新最优，
     * 因此等长时保留最先发现的那一段。
     *
     * @return 命中的区间；长度不足阈值时返回 {@link OverlapRun#NONE}
     */
    public OverlapRun findLongestRun(long[] seq1, long[] seq2, double minRatio) {
        requireRatio(minRatio);
        int m = seq1.length;
        int n = seq2.length;
        int minLength = minLength(m, n, minRatio);

        // 只依赖对角线前驱，滚动两行即可；两行放在同一块扁平数组里
        int stride = n + 1;
        int[] dp = new int[2 * stride];
        int maxLength = 0;
        int endI = 0;
        int endJ = 0;
        long matchCount = 0;

        for (int i = 1; i <= m; i++) {
            int cur = (i & 1) * stride;
            int prev = ((i - 1) & 1) * stride;
            long value = seq1[i - 1];
            dp[cur] = 0;
            for (int j = 1; j <= n; j++) {
                if (value == seq2[j - 1]) {
                    int length = dp[prev + j - 1] + 1;
                    dp[cur + j] = length;
                    matchCount++;
                    if (length > maxLength) {
                        maxLength = length;
                        endI = i;
                        endJ = j;
                    }
                } else {
                    dp[cur + j] = 0;
                }
            }
        }

        logger.debug("Longest run search: seq1={}, seq2={}, minLength={} (minRatio={}), matches={}, longest={}",
                m, n, minLength, minRatio, matchCount, maxLength);

        if (maxLength < minLength) {
            logger.debug("Longest run {} below threshold {}, no overlap", maxLength, minLength);
            return OverlapRun.NONE;
        }
        return new OverlapRun(endI - maxLength, endJ - maxLength, maxLength);
    }

    /**
     * 多候选区间
     * <p>
     * 1. 对每一对取值相同的位置 (i, j) 向后贪心扩展，保留长度 >= minLength 的区间
     * 2. 按长度降序（同长按 i、j 升序）排序并去掉完全相同的区间
     * 3. 依次挑选：与已选区间在 seq1 上的重叠超过自身长度一半的丢弃，最多选 topK 个
     * <p>
     * 最坏情况为同一取值出现次数的平方，纯色大图会明显变慢。
     */
    public List<OverlapRun> findTopRuns(long[] seq1, long[] seq2, double minRatio, int topK) {
        requireRatio(minRatio);
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1, got " + topK);
        }
        int m = seq1.length;
        int n = seq2.length;
        int minLength = minLength(m, n, minRatio);

        Map<Long, List<Integer>> positionsInSeq2 = new HashMap<>();
        for (int j = 0; j < n; j++) {
            positionsInSeq2.computeIfAbsent(seq2[j], k -> new ArrayList<>()).add(j);
        }

        List<OverlapRun> runs = new ArrayList<>();
        long pairs = 0;
        for (int i = 0; i < m; i++) {
            List<Integer> positions = positionsInSeq2.get(seq1[i]);
            if (positions == null) {
                continue;
            }
            for (int j : positions) {
                pairs++;
                int length = 0;
                while (i + length < m && j + length < n && seq1[i + length] == seq2[j + length]) {
                    length++;
                }
                if (length >= minLength) {
                    runs.add(new OverlapRun(i, j, length));
                }
            }
        }

        if (pairs > PAIR_WARN_THRESHOLD) {
            logger.warn("Top runs search extended {} position pairs; input is dominated by repeated rows", pairs);
        }

        if (runs.isEmpty()) {
            logger.debug("Top runs search: no run reaches minLength={} (seq1={}, seq2={})", minLength, m, n);
            return new ArrayList<>();
        }

        List<OverlapRun> ordered = runs.stream()
                .sorted(Comparator.comparingInt(OverlapRun::getLength).reversed()
                        .thenComparingInt(OverlapRun::getStartInSeq1)
                        .thenComparingInt(OverlapRun::getStartInSeq2))
                .distinct()
                .toList();

        List<OverlapRun> selected = new ArrayList<>();
        for (OverlapRun candidate : ordered) {
            if (!overlapsSignificantly(candidate, selected)) {
                selected.add(candidate);
                if (selected.size() >= topK) {
                    break;
                }
            }
        }

        logger.debug("Top runs search: {} raw runs, {} pairs, selected {}", runs.size(), pairs, selected);
        return selected;
    }

    /**
     * 在 seq1 坐标上与任一已选区间的重叠长度 > 候选长度 / 2（整数除法）
     */
    private static boolean overlapsSignificantly(OverlapRun candidate, List<OverlapRun> selected) {
        int start = candidate.getStartInSeq1();
        int end = candidate.getEndInSeq1();
        for (OverlapRun used : selected) {
            int overlapStart = Math.max(used.getStartInSeq1(), start);
            int overlapEnd = Math.min(used.getEndInSeq1(), end);
            if (overlapEnd > overlapStart && overlapEnd - overlapStart > candidate.getLength() / 2) {
                return true;
            }
        }
        return false;
    }

    static int minLength(int len1, int len2, double minRatio) {
        return Math.max(1, (int) Math.floor(Math.min(len1, len2) * minRatio));
    }

    private static void requireRatio(double minRatio) {
        if (Double.isNaN(minRatio) || minRatio < 0.0 || minRatio > 1.0) {
            throw new IllegalArgumentException("minRatio must be in [0, 1], got " + minRatio);
        }
    }
}
