package com.scroll.stitch.service;

import com.scroll.stitch.config.StitchProperties;
import com.scroll.stitch.core.hash.BatchHashPolicy;
import com.scroll.stitch.core.hash.HashAlgorithm;
import com.scroll.stitch.core.hash.HashOutcome;
import com.scroll.stitch.core.hash.ImageHasher;
import com.scroll.stitch.core.hash.RowHasher;
import com.scroll.stitch.dto.HashCompareRequest;
import com.scroll.stitch.dto.HashRequest;
import com.scroll.stitch.dto.RowHashRequest;
import com.scroll.stitch.util.Base64Images;
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
 * 指纹服务
 * <p>
 * 负责 Base64 边界转换和默认参数填充，计算本身交给无状态的 {@link ImageHasher} / {@link RowHasher}
 */
@Service
public class HashService {
    private static final Logger logger = LoggerFactory.getLogger(HashService.class);

    @Autowired
    private ImageHasher imageHasher;

    @Autowired
    private RowHasher rowHasher;

    @Autowired
    private StitchProperties properties;

    /**
     * 单张图片整图哈希
     */
    public Map<String, Object> hashImage(HashRequest request) {
        HashAlgorithm algorithm = resolveAlgorithm(request.getAlgorithm());
        int hashSize = resolveHashSize(request.getHashSize());
        byte[] bytes = Base64Images.decode(request.getImage(), "image");

        long hash = imageHasher.hash(bytes, algorithm, hashSize);
        logger.debug("{} hash (size {}) = {}", algorithm.getTag(), hashSize, Base64Images.toHex(hash));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("algorithm", algorithm.getTag());
        data.put("hashSize", hashSize);
        data.put("hash", Base64Images.toHex(hash));
        data.put("value", hash);
        return data;
    }

    /**
     * 批量整图哈希
     */
    public Map<String, Object> batchHash(HashRequest request) {
        if (request.getImages() == null || request.getImages().isEmpty()) {
            throw new IllegalArgumentException("images is required");
        }
        HashAlgorithm algorithm = resolveAlgorithm(request.getAlgorithm());
        int hashSize = resolveHashSize(request.getHashSize());
        BatchHashPolicy policy = BatchHashPolicy.fromName(
                request.getPolicy() != null ? request.getPolicy() : properties.getHash().getBatchPolicy());

        // Base64 格式错误属于请求错误，整体拒绝；图片内容错误才交给批量策略
        List<byte[]> images = new ArrayList<>(request.getImages().size());
        for (int i = 0; i < request.getImages().size(); i++) {
            images.add(Base64Images.decode(request.getImages().get(i), "images[" + i + "]"));
        }

        List<HashOutcome> outcomes = imageHasher.batchHash(images, algorithm, hashSize, policy);

        List<Map<String, Object>> items = new ArrayList<>(outcomes.size());
        int failed = 0;
        for (HashOutcome outcome : outcomes) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("index", outcome.getIndex());
            item.put("success", outcome.isSuccess());
            item.put("hash", Base64Images.toHex(outcome.getHash()));
            if (!outcome.isSuccess()) {
                item.put("error", outcome.getError());
                failed++;
            }
            items.add(item);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("algorithm", algorithm.getTag());
        data.put("hashSize", hashSize);
        data.put("policy", policy.name().toLowerCase(Locale.ROOT));
        data.put("failed", failed);
        data.put("results", items);
        return data;
    }

    /**
     * 比较两个指纹
     */
    public Map<String, Object> compare(HashCompareRequest request) {
        long hash1 = Base64Images.parseHex(request.getHash1(), "hash1");
        long hash2 = Base64Images.parseHex(request.getHash2(), "hash2");
        int hashSize = resolveHashSize(request.getHashSize());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("distance", ImageHasher.hammingDistance(hash1, hash2));
        data.put("similarity", ImageHasher.similarity(hash1, hash2, hashSize));
        return data;
    }

    /**
     * 行指纹序列
     */
    public Map<String, Object> rowHashes(RowHashRequest request) {
        int ignoreRight = request.getIgnoreRightPixels() != null
                ? request.getIgnoreRightPixels()
                : properties.getStitching().getIgnoreRightPixels();
        if (ignoreRight < 0) {
            throw new IllegalArgumentException("ignoreRightPixels must not be negative");
        }
        byte[] bytes = Base64Images.decode(request.getImage(), "image");
        long[] hashes = rowHasher.rowFingerprints(bytes, ignoreRight);

        List<Long> values = new ArrayList<>(hashes.length);
        for (long h : hashes) {
            values.add(h);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("rows", hashes.length);
        data.put("ignoreRightPixels", ignoreRight);
        data.put("hashes", values);
        return data;
    }

    private HashAlgorithm resolveAlgorithm(String tag) {
        return HashAlgorithm.fromTag(tag != null ? tag : properties.getHash().getAlgorithm());
    }

    private int resolveHashSize(Integer hashSize) {
        return hashSize != null ? hashSize : properties.getHash().getSize();
    }
}
