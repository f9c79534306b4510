package com.scroll.stitch.dto;

/**
 * 双图拼接请求
 * <p>
 * image1 在上（已有内容），image2 在下（新截图）。
 * 未填写的参数使用 application.yml 中的默认值。
 */
public class StitchRequest {
    private String image1;
    private String image2;
    private String strategy;
    private Integer ignoreRightPixels;
    private Double minOverlapRatio;
    private Integer topK;

    public String getImage1() { return image1; }
    public void setImage1(String image1) { this.image1 = image1; }

    public String getImage2() { return image2; }
    public void setImage2(String image2) { this.image2 = image2; }

    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public Integer getIgnoreRightPixels() { return ignoreRightPixels; }
    public void setIgnoreRightPixels(Integer ignoreRightPixels) { this.ignoreRightPixels = ignoreRightPixels; }

    public Double getMinOverlapRatio() { return minOverlapRatio; }
    public void setMinOverlapRatio(Double minOverlapRatio) { this.minOverlapRatio = minOverlapRatio; }

    public Integer getTopK() { return topK; }
    public void setTopK(Integer topK) { this.topK = topK; }
}
