package com.example.reportcard.util.loader;

import java.io.IOException;

/**
 * 文件无法加载（格式不支持、内容为空、无可抽取文本等）
 */
public class ReportLoadException extends IOException {

    public ReportLoadException(String message) {
        super(message);
    }

    public ReportLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
