package com.scroll.stitch.core.hash;

/**
 * 批量哈希中单张图片的结果
 * <p>
 * 失败时 {@code hash} 为占位值 0，调用方必须先看 {@link #isSuccess()}。
 */
public final class HashOutcome {
    public static final long PLACEHOLDER_HASH = 0L;

    private final int index;
    private final boolean success;
    private final long hash;
    private final String error;

    private HashOutcome(int index, boolean success, long hash, String error) {
        this.index = index;
        this.success = success;
        this.hash = hash;
        this.error = error;
    }

    public static HashOutcome success(int index, long hash) {
        return new HashOutcome(index, true, hash, null);
    }

    public static HashOutcome failure(int index, String error) {
        return new HashOutcome(index, false, PLACEHOLDER_HASH, error);
    }

    public int getIndex() { return index; }
    public boolean isSuccess() { return success; }
    public long getHash() { return hash; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return success
                ? "HashOutcome{index=" + index + ", hash=" + Long.toHexString(hash) + '}'
                : "HashOutcome{index=" + index + ", error='" + error + "'}";
    }
}
