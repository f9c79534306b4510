package com.scroll.stitch.dto;

/**
 * 行指纹请求
 */
public class RowHashRequest {
    private String image;
    private Integer ignoreRightPixels;

    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }

    public Integer getIgnoreRightPixels() { return ignoreRightPixels; }
    public void setIgnoreRightPixels(Integer ignoreRightPixels) { this.ignoreRightPixels = ignoreRightPixels; }
}
