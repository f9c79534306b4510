package com.scroll.stitch.dto;

import java.util.List;

/**
 * 序列匹配请求
 * <p>
 * 不传 topK 时只返回单一最长区间，传了则返回多候选
 */
public class SequenceMatchRequest {
    private List<Long> seq1;
    private List<Long> seq2;
    private Double minRatio;
    private Integer topK;

    public List<Long> getSeq1() { return seq1; }
    public void setSeq1(List<Long> seq1) { this.seq1 = seq1; }

    public List<Long> getSeq2() { return seq2; }
    public void setSeq2(List<Long> seq2) { this.seq2 = seq2; }

    public Double getMinRatio() { return minRatio; }
    public void setMinRatio(Double minRatio) { this.minRatio = minRatio; }

    public Integer getTopK() { return topK; }
    public void setTopK(Integer topK) { this.topK = topK; }
}
