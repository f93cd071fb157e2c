package com.example.reportcard.util.loader;

import com.example.reportcard.util.loader.dto.LoadedDocument;
import com.example.reportcard.util.record.dto.ReportTable;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class ReportDocumentLoaderTest {

    private final ReportDocumentLoader loader = new ReportDocumentLoader();

    @Test
    void loadsCsvWithQuotedFieldsAndBom() throws IOException {
        String csv = "\uFEFFSection,Label,Score,\n"
                + "Subjects,Mathematics,88,\r\n"
                + "\n"
                + "Co-curricular,\"Chess Club, Debate\",,\n";

        LoadedDocument document = loader.load("report.csv", csv.getBytes(StandardCharsets.UTF_8));

        assertThat(document.type).isEqualTo(LoadedDocument.FileType.CSV);
        ReportTable table = document.table;
        assertThat(table.getColumns()).containsExactly("Section", "Label", "Score", "Unnamed: 3");
        assertThat(table.getRowCount()).isEqualTo(2);
        assertThat(table.cell(0, 2)).isEqualTo("88");
        assertThat(table.cell(1, 1)).isEqualTo("Chess Club, Debate");
        assertThat(table.cell(1, 2)).isNull();
    }

    @Test
    void parsesEscapedQuotes() {
        List<List<String>> records = ReportDocumentLoader.parseCsv("Label,Notes\nHistory,\"said \"\"well done\"\"\"");

        assertThat(records).hasSize(2);
        assertThat(records.get(1)).containsExactly("History", "said \"well done\"");
    }

    @Test
    void decodeFallsBackToLatin1() {
        byte[] latin1 = new byte[]{'C', 'a', 'f', (byte) 0xE9};

        assertThat(ReportDocumentLoader.decode(latin1)).isEqualTo("Caf\u00e9");
    }

    @Test
    void loadsPlainText() throws IOException {
        LoadedDocument document = loader.load("notes.TXT", "Mathematics 88/100".getBytes(StandardCharsets.UTF_8));

        assertThat(document.type).isEqualTo(LoadedDocument.FileType.TEXT);
        assertThat(document.table).isNull();
        assertThat(document.text).isEqualTo("Mathematics 88/100");
    }

    @Test
    void rejectsImagesAndUnknownFormats() {
        byte[] content = new byte[]{1, 2, 3};

        assertThatThrownBy(() -> loader.load("scan.png", content))
                .isInstanceOf(ReportLoadException.class)
                .hasMessageContaining("scan.png");
        assertThatThrownBy(() -> loader.load("report.docx", content))
                .isInstanceOf(ReportLoadException.class);
        assertThatThrownBy(() -> loader.load("report.csv", new byte[0]))
                .isInstanceOf(ReportLoadException.class);
    }

    @Test
    void findsHeaderRowBelowMetadata() {
        List<List<String>> rows = sampleRows();

        assertThat(ReportDocumentLoader.findHeaderRow(rows, 15)).isEqualTo(3);
        assertThat(ReportDocumentLoader.findHeaderRow(rows, 2)).isEqualTo(-1);
    }

    @Test
    void extractsMetadataAboveHeader() {
        Map<String, String> metadata = ReportDocumentLoader.extractHeaderMetadata(sampleRows(), 3, 15);

        assertThat(metadata).containsExactly(
                entry("Student Name", "Ahmad Daniel"),
                entry("Form", "4"));
    }

    @Test
    void loadsExcelWithMetadataBlock() throws IOException {
        byte[] content;
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Report");
            writeRow(sheet, 0, "Student Name:", "Nurul Izzah");
            writeRow(sheet, 1, "State", "Perak");
            writeRow(sheet, 3, "Subject", "Score", "Maximum");
            Row maths = sheet.createRow(4);
            maths.createCell(0).setCellValue("Mathematics");
            maths.createCell(1).setCellValue(88);
            maths.createCell(2).setCellValue(100);
            workbook.write(out);
            content = out.toByteArray();
        }

        LoadedDocument document = loader.load("report.xlsx", content);

        assertThat(document.type).isEqualTo(LoadedDocument.FileType.EXCEL);
        assertThat(document.metadata).containsEntry("Student Name", "Nurul Izzah").containsEntry("State", "Perak");
        assertThat(document.table.getColumns()).containsExactly("Subject", "Score", "Maximum");
        assertThat(document.table.getRows()).containsExactly(Arrays.asList("Mathematics", "88", "100"));
    }

    @Test
    void extractsPdfTextLayer() throws IOException {
        byte[] content;
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            doc.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(doc, page)) {
                stream.beginText();
                stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                stream.newLineAtOffset(72, 700);
                stream.showText("Mathematics 88/100");
                stream.endText();
            }
            doc.save(out);
            content = out.toByteArray();
        }

        assertThat(loader.loadPdf(content)).isEqualTo("Mathematics 88/100");
    }

    @Test
    void rejectsPdfWithoutTextLayer() throws IOException {
        byte[] content;
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            doc.addPage(new PDPage());
            doc.save(out);
            content = out.toByteArray();
        }

        assertThatThrownBy(() -> loader.loadPdf(content)).isInstanceOf(ReportLoadException.class);
    }

    @Test
    void splitsCamelCaseFromPdfExtraction() {
        assertThat(ReportDocumentLoader.fixPdfExtraction("mathematicsScience")).isEqualTo("mathematics Science");
    }

    private static List<List<String>> sampleRows() {
        return Arrays.asList(
                Arrays.asList("Student Name", "Ahmad Daniel"),
                Arrays.asList("Form", "4"),
                Collections.<String>emptyList(),
                Arrays.asList("Subject", "Score", "Maximum"),
                Arrays.asList("Mathematics", "88", "100"));
    }

    private static void writeRow(Sheet sheet, int index, String... values) {
        Row row = sheet.createRow(index);
        for (int i = 0; i < values.length; i++) {
            row.createCell(i).setCellValue(values[i]);
        }
    }
}
