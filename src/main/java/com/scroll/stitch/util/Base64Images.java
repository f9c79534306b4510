package com.scroll.stitch.util;

import com.scroll.stitch.core.image.ImageDecodeException;

import java.util.Base64;

/**
 * Base64 图片内容与字节之间的转换
 * <p>
 * 兼容前端直接传 data URI（data:image/png;base64,...）
 */
public final class Base64Images {

    private Base64Images() {
    }

    public static byte[] decode(String base64, String label) {
        if (base64 == null || base64.isBlank()) {
            throw new IllegalArgumentException(label + " is required");
        }
        String payload = base64.trim();
        int comma = payload.indexOf(',');
        if (payload.startsWith("data:") && comma > 0) {
            payload = payload.substring(comma + 1);
        }
        try {
            return Base64.getMimeDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new ImageDecodeException("Failed to load " + label + ": invalid Base64 content", e);
        }
    }

    public static String encode(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * 64 位指纹的十六进制表示（无符号，固定 16 位）
     */
    public static String toHex(long hash) {
        return String.format("%016x", hash);
    }

    public static long parseHex(String hex, String label) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException(label + " is required");
        }
        String digits = hex.trim();
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
        }
        try {
            return Long.parseUnsignedLong(digits, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(label + " is not a 64-bit hex value: " + hex);
        }
    }
}
