package com.scroll.stitch.dto;

import java.util.List;

/**
 * 整图哈希请求（单张用 image，批量用 images）
 */
public class HashRequest {
    private String image;
    private List<String> images;
    private String algorithm;
    private Integer hashSize;
    private String policy;

    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }

    public List<String> getImages() { return images; }
    public void setImages(List<String> images) { this.images = images; }

    public String getAlgorithm() { return algorithm; }
    public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }

    public Integer getHashSize() { return hashSize; }
    public void setHashSize(Integer hashSize) { this.hashSize = hashSize; }

    public String getPolicy() { return policy; }
    public void setPolicy(String policy) { this.policy = policy; }
}
