package com.example.reportcard.controller;

import com.example.reportcard.service.ReportAnalysisService;
import com.example.reportcard.service.dto.AnalyzeTableRequest;
import com.example.reportcard.service.dto.AnalyzeTextRequest;
import com.example.reportcard.service.dto.ReportAnalysisResult;
import com.example.reportcard.util.loader.ReportLoadException;
import com.example.reportcard.util.record.dto.ReportTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * 成绩单分析控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/report")
public class ReportAnalysisController {

    @Autowired
    private ReportAnalysisService reportAnalysisService;

    /**
     * 上传文件分析（PDF / XLSX / XLS / CSV / TXT）
     *
     * @param file 成绩单文件
     * @return 包含分析结果的响应
     */
    @PostMapping("/analyze")
    public ResponseEntity<Map<String, Object>> analyzeFile(@RequestParam("file") MultipartFile file) {
        Map<String, Object> result = new HashMap<>();

        // 验证文件
        if (file.isEmpty()) {
            result.put("success", false);
            result.put("message", "文件不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        String originalFilename = file.getOriginalFilename();
        try {
            log.info("接收文件: {}", originalFilename);
            ReportAnalysisResult analysis = reportAnalysisService.analyzeFile(originalFilename, file.getBytes());
            return ok(result, analysis);

        } catch (ReportLoadException e) {
            log.warn("文件无法加载: {}, {}", originalFilename, e.getMessage());
            result.put("success", false);
            result.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(result);

        } catch (IOException e) {
            log.error("文件解析失败: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "文件解析失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 文本分析
     *
     * 请求体：{"text": "..."}
     */
    @PostMapping("/analyze-text")
    public ResponseEntity<Map<String, Object>> analyzeText(@RequestBody AnalyzeTextRequest request) {
        Map<String, Object> result = new HashMap<>();

        if (request == null || request.getText() == null || request.getText().trim().isEmpty()) {
            result.put("success", false);
            result.put("message", "text 不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        ReportAnalysisResult analysis = reportAnalysisService.analyzeText(request.getText());
        return ok(result, analysis);
    }

    /**
     * 表格分析
     *
     * 请求体：{"columns": [...], "rows": [[...], ...], "metadata": {...}}
     */
    @PostMapping("/analyze-table")
    public ResponseEntity<Map<String, Object>> analyzeTable(@RequestBody AnalyzeTableRequest request) {
        Map<String, Object> result = new HashMap<>();

        if (request == null || request.getColumns() == null || request.getColumns().isEmpty()) {
            result.put("success", false);
            result.put("message", "columns 不能为空");
            return ResponseEntity.badRequest().body(result);
        }
        if (request.getRows() == null) {
            result.put("success", false);
            result.put("message", "rows 不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        ReportTable table = new ReportTable(request.getColumns(), request.getRows());
        ReportAnalysisResult analysis = reportAnalysisService.analyzeTable(table, request.getMetadata());
        return ok(result, analysis);
    }

    private ResponseEntity<Map<String, Object>> ok(Map<String, Object> result, ReportAnalysisResult analysis) {
        result.put("success", true);
        result.put("message", analysis.isEmpty() ? "没有可抽取的数据" : "分析完成");
        result.put("data", analysis);
        return ResponseEntity.ok(result);
    }
}
