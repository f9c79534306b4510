package com.scroll.stitch.core.stitcher;

/**
 * 两张滚动截图的拼接策略
 * <p>
 * 上层的长截图会话只依赖这个接口：每来一张新截图就调用一次，
 * 根据返回的重叠结果自行决定是否接受或回滚。实现必须无状态。
 */
public interface StitchStrategy {

    /**
     * 拼接两张图
     *
     * @param upper 已有图像（上方，通常是之前的累积结果）
     * @param lower 新截图（下方，宽度以它为准）
     * @return 拼接结果；解码或编码失败时返回 success=false，不抛异常
     */
    StitchResult stitch(byte[] upper, byte[] lower);

    /**
     * 策略名称，例如 direct / smart
     */
    String getName();
}
