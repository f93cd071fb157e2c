package com.example.reportcard.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 文本分析请求
 */
public class AnalyzeTextRequest {

    @JsonProperty("text")
    private String text;

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
}
