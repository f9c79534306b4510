package com.scroll.stitch.service;

import com.scroll.stitch.config.StitchProperties;
import com.scroll.stitch.core.hash.RowHasher;
import com.scroll.stitch.core.matcher.OverlapRun;
import com.scroll.stitch.core.matcher.SequenceMatcher;
import com.scroll.stitch.core.stitcher.CandidateEvaluation;
import com.scroll.stitch.core.stitcher.DirectStitchStrategy;
import com.scroll.stitch.core.stitcher.SmartStitchStrategy;
import com.scroll.stitch.core.stitcher.StitchResult;
import com.scroll.stitch.core.stitcher.StitchStrategy;
import com.scroll.stitch.dto.SequenceMatchRequest;
import com.scroll.stitch.dto.StitchRequest;
import com.scroll.stitch.util.Base64Images;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 拼接服务
 * <p>
 * 策略说明：
 * - direct：底部窗口内最长公共区间，默认最小重叠比例 0.1
 * - smart：前 topK 个候选中取第一个不会让结果变矮的，默认最小重叠比例 0.01
 * <p>
 * 请求里带了参数覆盖时临时构造一个策略实例，否则复用配置好的单例。
 * 服务本身不保存任何拼接状态。
 */
@Service
public class StitchService {
    private static final Logger logger = LoggerFactory.getLogger(StitchService.class);

    @Autowired
    private StitchProperties properties;

    @Autowired
    private RowHasher rowHasher;

    @Autowired
    private SequenceMatcher sequenceMatcher;

    @Autowired
    private DirectStitchStrategy directStitchStrategy;

    @Autowired
    private SmartStitchStrategy smartStitchStrategy;

    private String defaultStrategy;

    @PostConstruct
    public void init() {
        defaultStrategy = normalizeStrategy(properties.getStitching().getStrategy());
        logger.info("StitchService initialized with default strategy: {}", defaultStrategy);
    }

    public String getDefaultStrategy() {
        return defaultStrategy;
    }

    /**
     * 策略名规范化，兼容旧的引擎别名
     */
    public static String normalizeStrategy(String name) {
        if (name == null || name.isBlank()) {
            return SmartStitchStrategy.NAME;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "direct":
            case "hash":
            case "hash_rust":
            case "lcs":
                return DirectStitchStrategy.NAME;
            case "smart":
            case "hash_smart":
                return SmartStitchStrategy.NAME;
            default:
                throw new IllegalArgumentException("Invalid strategy: " + name + ". Only 'direct' and 'smart' are supported.");
        }
    }

    /**
     * 获取拼接策略实例；名称为空时用配置的默认策略，有参数覆盖时按覆盖值新建
     */
    public StitchStrategy getStrategy(String name, Integer ignoreRightPixels, Double minOverlapRatio, Integer topK) {
        String strategy = name == null || name.isBlank() ? defaultStrategy : normalizeStrategy(name);
        StitchProperties.StitchingConfig config = properties.getStitching();
        boolean overridden = ignoreRightPixels != null || minOverlapRatio != null || topK != null;

        if (DirectStitchStrategy.NAME.equals(strategy)) {
            if (!overridden) {
                return directStitchStrategy;
            }
            return new DirectStitchStrategy(rowHasher, sequenceMatcher,
                    ignoreRightPixels != null ? ignoreRightPixels : config.getIgnoreRightPixels(),
                    minOverlapRatio != null ? minOverlapRatio : config.getMinOverlapRatio());
        }

        if (!overridden) {
            return smartStitchStrategy;
        }
        return new SmartStitchStrategy(rowHasher, sequenceMatcher,
                ignoreRightPixels != null ? ignoreRightPixels : config.getIgnoreRightPixels(),
                minOverlapRatio != null ? minOverlapRatio : config.getSmartMinOverlapRatio(),
                topK != null ? topK : config.getTopK());
    }

    /**
     * 拼接两张 Base64 图片
     */
    public StitchResult stitch(StitchRequest request) {
        byte[] upper = Base64Images.decode(request.getImage1(), "image1");
        byte[] lower = Base64Images.decode(request.getImage2(), "image2");

        StitchStrategy strategy = getStrategy(request.getStrategy(), request.getIgnoreRightPixels(),
                request.getMinOverlapRatio(), request.getTopK());

        long start = System.currentTimeMillis();
        StitchResult result = strategy.stitch(upper, lower);
        logger.info("Stitch [{}] finished in {} ms: {}", strategy.getName(), System.currentTimeMillis() - start, result);
        return result;
    }

    /**
     * 直接对两个指纹序列做匹配
     */
    public Map<String, Object> match(SequenceMatchRequest request) {
        long[] seq1 = toArray(request.getSeq1(), "seq1");
        long[] seq2 = toArray(request.getSeq2(), "seq2");
        double minRatio = request.getMinRatio() != null ? request.getMinRatio() : SequenceMatcher.DEFAULT_MIN_RATIO;

        Map<String, Object> data = new LinkedHashMap<>();
        if (request.getTopK() == null) {
            OverlapRun run = sequenceMatcher.findLongestRun(seq1, seq2, minRatio);
            data.put("found", run.isFound());
            data.put("run", describe(run));
        } else {
            List<OverlapRun> runs = sequenceMatcher.findTopRuns(seq1, seq2, minRatio, request.getTopK());
            List<Map<String, Object>> items = new ArrayList<>(runs.size());
            for (OverlapRun run : runs) {
                items.add(describe(run));
            }
            data.put("found", !runs.isEmpty());
            data.put("runs", items);
        }
        return data;
    }

    /**
     * 拼接结果转为响应数据（不含失败情况）
     */
    public Map<String, Object> describe(StitchResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("strategy", result.getStrategy());
        data.put("image", Base64Images.encode(result.getImage()));
        data.put("width", result.getWidth());
        data.put("height", result.getHeight());
        data.put("image1Height", result.getImage1Height());
        data.put("image2Height", result.getImage2Height());
        data.put("searchStart", result.getSearchStart());
        data.put("overlapFound", result.isOverlapFound());
        data.put("overlap", describe(result.getOverlap()));
        data.put("keptFromImage1", result.getKeptFromImage1());
        data.put("skippedFromImage2", result.getSkippedFromImage2());
        data.put("shrunk", result.isShrunk());

        List<Map<String, Object>> candidates = new ArrayList<>();
        for (CandidateEvaluation candidate : result.getCandidates()) {
            Map<String, Object> item = describe(candidate.getRun());
            item.put("predictedHeight", candidate.getPredictedHeight());
            item.put("shrinks", candidate.isShrinks());
            item.put("accepted", candidate.isAccepted());
            candidates.add(item);
        }
        data.put("candidates", candidates);
        return data;
    }

    private static Map<String, Object> describe(OverlapRun run) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("startInSeq1", run.getStartInSeq1());
        item.put("startInSeq2", run.getStartInSeq2());
        item.put("length", run.getLength());
        return item;
    }

    private static long[] toArray(List<Long> values, String label) {
        if (values == null) {
            throw new IllegalArgumentException(label + " is required");
        }
        long[] array = new long[values.size()];
        for (int i = 0; i < array.length; i++) {
            Long value = values.get(i);
            if (value == null) {
                throw new IllegalArgumentException(label + "[" + i + "] is null");
            }
            array[i] = value;
        }
        return array;
    }
}
