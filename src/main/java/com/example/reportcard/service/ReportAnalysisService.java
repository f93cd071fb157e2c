package com.example.reportcard.service;

import com.example.reportcard.service.dto.ReportAnalysisResult;
import com.example.reportcard.util.behaviour.BehaviourExtractor;
import com.example.reportcard.util.behaviour.dto.Rating;
import com.example.reportcard.util.entity.StudentEntityExtractor;
import com.example.reportcard.util.entity.dto.StudentMetadata;
import com.example.reportcard.util.loader.ReportDocumentLoader;
import com.example.reportcard.util.loader.dto.LoadedDocument;
import com.example.reportcard.util.ranking.RankingExtractor;
import com.example.reportcard.util.record.CanonicalRecordBuilder;
import com.example.reportcard.util.record.dto.CanonicalRecord;
import com.example.reportcard.util.record.dto.ReportTable;
import com.example.reportcard.util.stats.StatisticsAggregator;
import com.example.reportcard.util.stats.dto.StatisticsBundle;
import com.example.reportcard.util.subject.SubjectResolver;
import com.example.reportcard.util.subject.dto.SubjectSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * 成绩单分析服务
 *
 * 每份文档独立计算：文本/表格 → 规范化记录 → {学生元数据, 科目, 行为评级, 排名, 统计}。
 * 服务本身无状态，可并发调用。
 */
@Slf4j
@Service
public class ReportAnalysisService {

    @Value("${report.ranking.top-n:5}")
    private int topN = RankingExtractor.DEFAULT_TOP_N;

    @Autowired
    private ReportDocumentLoader documentLoader;

    /**
     * 加载并分析上传文件
     *
     * @param filename 文件名
     * @param content  文件内容
     * @return 分析结果
     * @throws IOException 文件无法加载
     */
    public ReportAnalysisResult analyzeFile(String filename, byte[] content) throws IOException {
        LoadedDocument document = documentLoader.load(filename, content);
        return analyze(document);
    }

    /**
     * 分析已加载的文档
     */
    public ReportAnalysisResult analyze(LoadedDocument document) {
        if (document.table != null) {
            return analyzeTable(document.table, document.metadata);
        }
        return analyzeText(document.text);
    }

    /**
     * 分析 OCR/PDF 文本
     *
     * @param text 一份文档的文本
     * @return 分析结果
     */
    public ReportAnalysisResult analyzeText(String text) {
        long start = System.currentTimeMillis();

        List<CanonicalRecord> records = CanonicalRecordBuilder.fromText(text);
        StudentMetadata student = StudentEntityExtractor.fromText(text)
                .mergeFrom(StudentEntityExtractor.fromRecords(records));

        ReportAnalysisResult result = assemble(records, StatisticsAggregator.compute(records), student, text);
        log.info("文本分析完成: {} 条记录, 科目 {} 个, 行为评级 {} 项, 耗时 {} ms",
                records.size(), result.getSubjectScores().size(), result.getBehaviour().size(),
                System.currentTimeMillis() - start);
        return result;
    }

    /**
     * 分析表格
     *
     * 已是规范化结构的表格（含 Section/Label 列）直接在记录上统计；
     * 其他表格在原始列上统计（每列所有非空单元格都是数字即为数值列）。
     *
     * @param table    表格
     * @param metadata 加载器给出的表头元数据（可为 null）
     * @return 分析结果
     */
    public ReportAnalysisResult analyzeTable(ReportTable table, Map<String, String> metadata) {
        long start = System.currentTimeMillis();

        List<CanonicalRecord> records = CanonicalRecordBuilder.fromTable(table);
        StatisticsBundle statistics = CanonicalRecordBuilder.isCanonical(table)
                ? StatisticsAggregator.compute(records)
                : StatisticsAggregator.compute(table);

        // 优先级：表头元数据 → 列名/行扫描 → 规范化记录
        StudentMetadata student = StudentEntityExtractor.fromPairs(metadata)
                .mergeFrom(StudentEntityExtractor.fromTable(table))
                .mergeFrom(StudentEntityExtractor.fromRecords(records));

        ReportAnalysisResult result = assemble(records, statistics, student, tableText(table));
        log.info("表格分析完成: {} 行, {} 条记录, 耗时 {} ms",
                table == null ? 0 : table.getRowCount(), records.size(), System.currentTimeMillis() - start);
        return result;
    }

    // ==================== 私有方法 ====================

    private ReportAnalysisResult assemble(List<CanonicalRecord> records, StatisticsBundle statistics,
                                          StudentMetadata student, String text) {
        ReportAnalysisResult result = new ReportAnalysisResult();
        result.setRecords(records);
        result.setStatistics(statistics);
        result.setStudent(student);

        SubjectSummary subjects = SubjectResolver.resolve(records);
        result.setSubjectScores(subjects.scores);
        result.setStrength(subjects.strength);
        result.setWeakness(subjects.weakness);

        Map<String, Rating> behaviour = BehaviourExtractor.extract(records, text);
        result.setBehaviour(behaviour);
        result.setBehaviourByRating(BehaviourExtractor.groupByRating(behaviour));

        result.setTopScores(RankingExtractor.topN(records, topN));
        result.setActivities(SubjectResolver.collectActivities(records));
        result.setEmpty(records.isEmpty() && student.isEmpty());

        if (result.isEmpty()) {
            log.warn("没有可抽取的数据");
        }
        return result;
    }

    /**
     * 表格按行拼成文本（供行为评级文本抽取兜底）
     */
    private static String tableText(ReportTable table) {
        if (table == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (List<String> row : table.getRows()) {
            if (row == null) {
                continue;
            }
            StringBuilder line = new StringBuilder();
            for (String cell : row) {
                if (cell != null && !cell.trim().isEmpty()) {
                    if (line.length() > 0) {
                        line.append(' ');
                    }
                    line.append(cell.trim());
                }
            }
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
