package com.scroll.stitch.core.hash;

import java.util.Locale;

/**
 * 批量哈希时单张图片解码失败的处理策略
 */
public enum BatchHashPolicy {
    /**
     * 任意一张失败即整体失败，抛出下标最小的那个错误
     */
    STRICT,
    /**
     * 逐张隔离：失败项以占位哈希 0 返回，并标记 success=false 和错误信息
     */
    LENIENT;

    public static BatchHashPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return STRICT;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown batch policy: " + name + ". Use 'strict' or 'lenient'.");
        }
    }
}
