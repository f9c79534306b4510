package com.scroll.stitch.dto;

/**
 * 指纹比较请求，指纹用十六进制字符串表示
 */
public class HashCompareRequest {
    private String hash1;
    private String hash2;
    private Integer hashSize;

    public String getHash1() { return hash1; }
    public void setHash1(String hash1) { this.hash1 = hash1; }

    public String getHash2() { return hash2; }
    public void setHash2(String hash2) { this.hash2 = hash2; }

    public Integer getHashSize() { return hashSize; }
    public void setHashSize(Integer hashSize) { this.hashSize = hashSize; }
}
