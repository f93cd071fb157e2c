package com.example.reportcard.service;

import com.example.reportcard.service.dto.ReportAnalysisResult;
import com.example.reportcard.util.behaviour.dto.Rating;
import com.example.reportcard.util.entity.dto.Gender;
import com.example.reportcard.util.loader.ReportDocumentLoader;
import com.example.reportcard.util.ranking.dto.RankingEntry;
import com.example.reportcard.util.record.dto.ReportTable;
import com.example.reportcard.util.stats.dto.StatisticsBundle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ReportAnalysisServiceTest {

    private static final String REPORT_TEXT =
            "Student Details\n"
            + "Name: Ahmad Daniel\n"
            + "Gender: Male\n"
            + "State: Selangor\n"
            + "Subjects\n"
            + "Mathematics 88/100\n"
            + "English 74/100\n"
            + "Science 91/100\n"
            + "Behaviour\n"
            + "Attentiveness Good\n"
            + "Punctuality Excellent\n"
            + "Co-curricular\n"
            + "Chess Club Member\n";

    private ReportAnalysisService service;

    @BeforeEach
    void setUp() {
        service = new ReportAnalysisService();
        ReflectionTestUtils.setField(service, "documentLoader", new ReportDocumentLoader());
    }

    @Test
    void analyzesOcrText() {
        ReportAnalysisResult result = service.analyzeText(REPORT_TEXT);

        assertThat(result.isEmpty()).isFalse();
        assertThat(result.getRecords()).hasSize(9);
        assertThat(result.getStudent().getName()).isEqualTo("Ahmad Daniel");
        assertThat(result.getStudent().getGender()).isEqualTo(Gender.MALE);
        assertThat(result.getStudent().getState()).isEqualTo("Selangor");

        assertThat(result.getSubjectScores()).containsExactly(
                entry("Mathematics", 88.0), entry("English", 74.0), entry("Science", 91.0));
        assertThat(result.getStrength()).isEqualTo("Science");
        assertThat(result.getWeakness()).isEqualTo("English");

        assertThat(result.getBehaviour()).containsExactly(
                entry("Attentiveness", Rating.GOOD), entry("Punctuality", Rating.EXCELLENT));
        assertThat(result.getBehaviourByRating()).containsOnlyKeys("Good", "Excellent");

        assertThat(result.getTopScores()).containsExactly(
                new RankingEntry("Science", 91), new RankingEntry("Mathematics", 88), new RankingEntry("English", 74));
        assertThat(result.getActivities()).containsExactly("Chess Club Member");

        StatisticsBundle statistics = result.getStatistics();
        assertThat(statistics.getRowCount()).isEqualTo(9);
        assertThat(statistics.getCounts()).containsEntry("Score", 3);
        assertThat(statistics.getTrends()).containsEntry("Score", StatisticsBundle.Trend.INCREASING);
    }

    @Test
    void analyzesCanonicalTableWithLoaderMetadata() {
        ReportTable table = new ReportTable(
                Arrays.asList("Section", "Label", "Score", "Maximum", "Value", "Notes"),
                Arrays.asList(
                        Arrays.asList("Subjects", "Mathematics", "80", "100", null, null),
                        Arrays.asList("Subjects", "Biology", "95", "100", null, null),
                        Arrays.asList("Behaviour", "Punctuality", null, null, "Good", null),
                        Arrays.asList("Co-curricular", "Debate Society", null, null, null, null)));

        ReportAnalysisResult result = service.analyzeTable(table,
                Collections.singletonMap("Student Name", "Nurul Izzah"));

        assertThat(result.getStudent().getName()).isEqualTo("Nurul Izzah");
        assertThat(result.getSubjectScores()).containsExactly(entry("Mathematics", 80.0), entry("Biology", 95.0));
        assertThat(result.getStrength()).isEqualTo("Biology");
        assertThat(result.getBehaviour()).containsExactly(entry("Punctuality", Rating.GOOD));
        assertThat(result.getActivities()).containsExactly("Debate Society");
        assertThat(result.getStatistics().getNumericColumns()).containsExactly("Score", "Maximum");
    }

    @Test
    void rawTablesUseTheirOwnNumericColumns() {
        ReportTable table = new ReportTable(
                Arrays.asList("Subject", "Term 1", "Term 2"),
                Arrays.asList(
                        Arrays.asList("Mathematics", "60", "80"),
                        Arrays.asList("English", "70", "65")));

        ReportAnalysisResult result = service.analyzeTable(table, null);

        assertThat(result.getSubjectScores()).containsOnlyKeys("Mathematics", "English");
        assertThat(result.getStatistics().getNumericColumns()).containsExactly("Term 1", "Term 2");
        assertThat(result.getStatistics().getTrends()).containsEntry("Term 2", StatisticsBundle.Trend.DECREASING);
    }

    @Test
    void analyzesUploadedCsv() throws IOException {
        byte[] csv = "Section,Label,Score,Maximum\nSubjects,History,67,100\n".getBytes(StandardCharsets.UTF_8);

        ReportAnalysisResult result = service.analyzeFile("history.csv", csv);

        assertThat(result.getSubjectScores()).containsExactly(entry("History", 67.0));
    }

    @Test
    void blankTextIsEmpty() {
        ReportAnalysisResult result = service.analyzeText("  \n  ");

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getTopScores()).isEmpty();
    }
}
