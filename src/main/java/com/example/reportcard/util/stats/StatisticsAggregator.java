package com.example.reportcard.util.stats;

import com.example.reportcard.util.common.TextUtils;
import com.example.reportcard.util.record.CanonicalRecordBuilder;
import com.example.reportcard.util.record.dto.CanonicalRecord;
import com.example.reportcard.util.record.dto.ReportTable;
import com.example.reportcard.util.stats.dto.StatisticsBundle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 统计聚合器
 *
 * 对每个数值列计算：
 * - 均值、中位数、总体标准差（除以 n，不是 n-1）、非空计数
 * - 趋势：按原有顺序比较首尾两个非空值，少于 2 个非空值时不给出
 * - 预测信号：最近 3 个非空值的均值与整体均值比较，少于 3 个非空值时不给出
 */
@Slf4j
public class StatisticsAggregator {

    public static final String ABOVE_AVERAGE = "Recent performance is above average.";
    public static final String BELOW_AVERAGE = "Recent performance is below average.";
    public static final String CONSISTENT = "Performance is consistent.";

    private static final int MIN_TREND_VALUES = 2;
    private static final int RECENT_WINDOW = 3;

    /**
     * 规范化表格的列
     */
    private static final List<String> CANONICAL_COLUMNS = Collections.unmodifiableList(Arrays.asList(
        CanonicalRecordBuilder.COL_SECTION, CanonicalRecordBuilder.COL_LABEL, CanonicalRecordBuilder.COL_SCORE,
        CanonicalRecordBuilder.COL_MAXIMUM, CanonicalRecordBuilder.COL_VALUE, CanonicalRecordBuilder.COL_NOTES));

    // ==================== 公共方法 ====================

    /**
     * 规范化表格统计（数值列固定为 Score、Maximum）
     *
     * @param records 规范化记录
     * @return 统计结果（异常时返回只含行列数的结果）
     */
    public static StatisticsBundle compute(List<CanonicalRecord> records) {
        StatisticsBundle bundle = new StatisticsBundle();
        try {
            List<CanonicalRecord> rows = records != null ? records : new ArrayList<CanonicalRecord>();
            bundle.setRowCount(rows.size());
            bundle.setColumnCount(CANONICAL_COLUMNS.size());

            List<Double> scores = new ArrayList<>();
            List<Double> maximums = new ArrayList<>();
            for (CanonicalRecord record : rows) {
                scores.add(record.getScore());
                maximums.add(record.getMaximum());
            }
            addColumn(bundle, CanonicalRecordBuilder.COL_SCORE, scores);
            addColumn(bundle, CanonicalRecordBuilder.COL_MAXIMUM, maximums);
        } catch (Exception e) {
            log.warn("统计计算失败: {}", e.getMessage(), e);
        }
        return bundle;
    }

    /**
     * 原始表格统计
     *
     * 一列的所有非空单元格都能解析为数字时视为数值列；
     * 整列为空的列也视为数值列，只在 counts 中以 0 出现。
     *
     * @param table 表格
     * @return 统计结果
     */
    public static StatisticsBundle compute(ReportTable table) {
        StatisticsBundle bundle = new StatisticsBundle();
        try {
            if (table == null) {
                return bundle;
            }
            bundle.setRowCount(table.getRowCount());
            bundle.setColumnCount(table.getColumns().size());

            for (int c = 0; c < table.getColumns().size(); c++) {
                List<Double> values = numericColumn(table, c);
                if (values != null) {
                    addColumn(bundle, table.getColumns().get(c), values);
                }
            }
        } catch (Exception e) {
            log.warn("表格统计计算失败: {}", e.getMessage(), e);
        }
        return bundle;
    }

    /**
     * 按原有顺序比较首尾非空值
     *
     * @param series 数列（可含 null）
     * @return 趋势；非空值少于 2 个返回 null
     */
    public static StatisticsBundle.Trend trend(List<Double> series) {
        List<Double> values = nonNull(series);
        if (values.size() < MIN_TREND_VALUES) {
            return null;
        }
        int cmp = Double.compare(values.get(values.size() - 1), values.get(0));
        if (cmp > 0) {
            return StatisticsBundle.Trend.INCREASING;
        }
        if (cmp < 0) {
            return StatisticsBundle.Trend.DECREASING;
        }
        return StatisticsBundle.Trend.STABLE;
    }

    /**
     * 最近 3 个非空值的均值 vs 整体均值
     *
     * 示例：[50, 50, 50, 90, 90] 最近均值 76.67 > 整体均值 66 → 高于平均
     *
     * @param series 数列（可含 null）
     * @return 三个固定短语之一；非空值少于 3 个返回 null
     */
    public static String predictiveInsight(List<Double> series) {
        List<Double> values = nonNull(series);
        if (values.size() < RECENT_WINDOW) {
            return null;
        }
        double recent = mean(values.subList(values.size() - RECENT_WINDOW, values.size()));
        double overall = mean(values);
        int cmp = Double.compare(recent, overall);
        if (cmp > 0) {
            return ABOVE_AVERAGE;
        }
        if (cmp < 0) {
            return BELOW_AVERAGE;
        }
        return CONSISTENT;
    }

    public static double mean(List<Double> values) {
        double sum = 0;
        for (Double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * 中位数（偶数个时取中间两个的平均）
     */
    public static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    /**
     * 总体标准差
     */
    public static double populationStdDev(List<Double> values) {
        double m = mean(values);
        double squares = 0;
        for (Double v : values) {
            squares += (v - m) * (v - m);
        }
        return Math.sqrt(squares / values.size());
    }

    // ==================== 私有方法 ====================

    private static void addColumn(StatisticsBundle bundle, String column, List<Double> series) {
        List<Double> values = nonNull(series);
        bundle.getNumericColumns().add(column);
        bundle.getCounts().put(column, values.size());
        if (values.isEmpty()) {
            return;
        }

        bundle.getAverages().put(column, mean(values));
        bundle.getMedians().put(column, median(values));
        bundle.getStdDev().put(column, populationStdDev(values));

        StatisticsBundle.Trend trend = trend(values);
        if (trend != null) {
            bundle.getTrends().put(column, trend);
        }
        String insight = predictiveInsight(values);
        if (insight != null) {
            bundle.getPredictiveInsights().put(column, insight);
        }
    }

    /**
     * 解析一列为数值；存在无法解析的非空单元格时返回 null（非数值列）
     */
    private static List<Double> numericColumn(ReportTable table, int column) {
        List<Double> values = new ArrayList<>();
        for (int r = 0; r < table.getRowCount(); r++) {
            String cell = table.cell(r, column);
            if (TextUtils.isBlank(cell)) {
                values.add(null);
                continue;
            }
            try {
                values.add(Double.parseDouble(cell.trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return values;
    }

    private static List<Double> nonNull(List<Double> series) {
        List<Double> values = new ArrayList<>();
        if (series == null) {
            return values;
        }
        for (Double v : series) {
            if (v != null && !v.isNaN()) {
                values.add(v);
            }
        }
        return values;
    }
}
