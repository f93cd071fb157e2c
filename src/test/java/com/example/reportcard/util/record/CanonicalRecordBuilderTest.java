package com.example.reportcard.util.record;

import com.example.reportcard.util.record.dto.CanonicalRecord;
import com.example.reportcard.util.record.dto.ReportTable;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalRecordBuilderTest {

    private static final String REPORT =
            "Student Details\n"
            + "Name: Ahmad Daniel\n"
            + "Gender: Male\n"
            + "\n"
            + "Subjects\n"
            + "Mathematics 88/100\n"
            + "English  74 of 100\n"
            + "Behaviour\n"
            + "Punctuality: Avg\n"
            + "Co-curricular\n"
            + "Chess Club Member\n";

    @Test
    void buildsRecordsFromOcrText() {
        List<CanonicalRecord> records = CanonicalRecordBuilder.fromText(REPORT);

        assertThat(records).extracting(CanonicalRecord::getSection).containsExactly(
                "Student Details", "Student Details", "Subjects", "Subjects", "Behaviour", "Co-curricular");

        CanonicalRecord maths = records.get(2);
        assertThat(maths.getLabel()).isEqualTo("Mathematics");
        assertThat(maths.getScore()).isEqualTo(88.0);
        assertThat(maths.getMaximum()).isEqualTo(100.0);

        CanonicalRecord rating = records.get(4);
        assertThat(rating.getLabel()).isEqualTo("Punctuality");
        assertThat(rating.getValue()).isEqualTo("Fair");
        assertThat(rating.getNotes()).isEqualTo("Avg");

        assertThat(records.get(5).isMisc()).isTrue();
        assertThat(records.get(5).getLabel()).isEqualTo("Chess Club Member");
    }

    @Test
    void splitsPipeSeparatedColumns() {
        List<CanonicalRecord> records = CanonicalRecordBuilder.fromText("Science 91/100 | Chess Club Member");

        assertThat(records).hasSize(2);
        assertThat(records.get(0).getScore()).isEqualTo(91.0);
        assertThat(records.get(1).getLabel()).isEqualTo("Chess Club Member");
    }

    @Test
    void passesCanonicalTablesThrough() {
        ReportTable table = new ReportTable(
                Arrays.asList("section", "Label", "Score", "Maximum", "Value", "Notes"),
                Arrays.asList(
                        Arrays.asList("Subjects", "Mathematics", "88", "100", null, null),
                        Arrays.asList("Behaviour", "Punctuality", "nan", null, "Good", null),
                        Arrays.asList(null, "Chess Club", null, null, null, "captain"),
                        Arrays.asList(null, "  ", "5", null, null, null),
                        Arrays.asList("Subjects", "Art", "-5", "abc", null, null)));

        List<CanonicalRecord> records = CanonicalRecordBuilder.fromTable(table);

        assertThat(records).hasSize(4);
        assertThat(records.get(0).getScore()).isEqualTo(88.0);
        assertThat(records.get(1).getScore()).isNull();
        assertThat(records.get(1).getValue()).isEqualTo("Good");
        assertThat(records.get(2).getSection()).isEqualTo("Misc");
        assertThat(records.get(2).getNotes()).isEqualTo("captain");
        assertThat(records.get(3).getScore()).isNull();
        assertThat(records.get(3).getMaximum()).isNull();
    }

    @Test
    void joinsCellsOfNonCanonicalTables() {
        ReportTable table = new ReportTable(
                Arrays.asList("Subject", "Score"),
                Arrays.asList(
                        Arrays.asList("Mathematics", "88"),
                        Arrays.asList("English", "74")));

        List<CanonicalRecord> records = CanonicalRecordBuilder.fromTable(table);

        assertThat(records).extracting(CanonicalRecord::getLabel).containsExactly("Mathematics", "English");
        assertThat(records).extracting(CanonicalRecord::getScore).containsExactly(88.0, 74.0);
        assertThat(records).extracting(CanonicalRecord::getSection).containsOnly("Subjects");
    }

    @Test
    void coercesNumbers() {
        assertThat(CanonicalRecordBuilder.coerceNumber("1,200")).isEqualTo(1200.0);
        assertThat(CanonicalRecordBuilder.coerceNumber(" 74.5 ")).isEqualTo(74.5);
        assertThat(CanonicalRecordBuilder.coerceNumber("NaN")).isNull();
        assertThat(CanonicalRecordBuilder.coerceNumber("Infinity")).isNull();
        assertThat(CanonicalRecordBuilder.coerceNumber("-3")).isNull();
        assertThat(CanonicalRecordBuilder.coerceNumber("A+")).isNull();
    }

    @Test
    void emptyInputsGiveEmptyLists() {
        assertThat(CanonicalRecordBuilder.fromText(null)).isEmpty();
        assertThat(CanonicalRecordBuilder.fromText("   ")).isEmpty();
        assertThat(CanonicalRecordBuilder.fromTable(new ReportTable())).isEmpty();
    }
}
