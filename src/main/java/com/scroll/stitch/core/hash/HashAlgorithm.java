package com.scroll.stitch.core.hash;

import java.util.Locale;

/**
 * 整图感知哈希算法
 * <p>
 * | 算法 | 原理 | 特点 |
 * |------|------|------|
 * | dHash | 相邻像素灰度差 | 快，对缩放鲁棒 |
 * | aHash | 像素与均值比较 | 最快，精度最低 |
 * | pHash | DCT 低频系数与中位数比较 | 最稳健，最慢 |
 */
public enum HashAlgorithm {
    DHASH("dhash"),
    AHASH("ahash"),
    PHASH("phash");

    private final String tag;

    HashAlgorithm(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static HashAlgorithm fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (HashAlgorithm algorithm : values()) {
                if (algorithm.tag.equals(normalized)) {
                    return algorithm;
                }
            }
        }
        throw new IllegalArgumentException("Unknown hash method: " + tag);
    }
}
