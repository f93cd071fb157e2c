package com.example.reportcard.util.subject;

import com.example.reportcard.util.record.CanonicalRecordBuilder;
import com.example.reportcard.util.record.dto.CanonicalRecord;
import com.example.reportcard.util.subject.dto.SubjectSummary;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class SubjectResolverTest {

    @Test
    void resolvesKnownSubjectsFromSubjectsSection() {
        List<CanonicalRecord> records = Arrays.asList(
                new CanonicalRecord("Subjects", "Mathematics", 88.0, 100.0, null, null),
                new CanonicalRecord("Subjects", "Score in English", 74.0, 100.0, null, null),
                new CanonicalRecord("Subjects", "Additional Mathematics paper", 65.0, null, null, null),
                new CanonicalRecord("Subjects", "Class position", 3.0, null, null, null),
                new CanonicalRecord("Behaviour", "Science", 91.0, null, null, null));

        SubjectSummary summary = SubjectResolver.resolve(records);

        assertThat(summary.scores).containsExactly(
                entry("Mathematics", 88.0),
                entry("English", 74.0),
                entry("Additional Mathematics", 65.0));
        assertThat(summary.strength).isEqualTo("Mathematics");
        assertThat(summary.weakness).isEqualTo("Additional Mathematics");
    }

    @Test
    void lastSeenScoreWins() {
        List<CanonicalRecord> records = Arrays.asList(
                new CanonicalRecord("Subjects", "History", 60.0, null, null, null),
                new CanonicalRecord("Subjects", "History", 70.0, null, null, null));

        assertThat(SubjectResolver.resolve(records).scores).containsExactly(entry("History", 70.0));
    }

    @Test
    void tiesGoToFirstEncountered() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("Biology", 80.0);
        scores.put("Chemistry", 80.0);

        assertThat(SubjectResolver.strength(scores)).isEqualTo("Biology");
        assertThat(SubjectResolver.weakness(scores)).isEqualTo("Biology");
    }

    @Test
    void noSubjectsMeansNoStrengthOrWeakness() {
        SubjectSummary summary = SubjectResolver.resolve(Collections.<CanonicalRecord>emptyList());

        assertThat(summary.isEmpty()).isTrue();
        assertThat(summary.strength).isNull();
        assertThat(summary.weakness).isNull();
    }

    @Test
    void resolveSubjectPrefersLastToken() {
        assertThat(SubjectResolver.resolveSubject("Bahasa Malay")).isEqualTo("Malay");
        assertThat(SubjectResolver.resolveSubject("Physical Education (PE) practical")).isEqualTo("Physical Education");
        assertThat(SubjectResolver.resolveSubject("Homework")).isNull();
    }

    @Test
    void collectsActivities() {
        List<CanonicalRecord> records = Arrays.asList(
                new CanonicalRecord("Co-curricular", "Chess Club Member / Debate Society", null, null, null, null),
                new CanonicalRecord("Co-curricular", "Red Crescent", null, null, null, null),
                new CanonicalRecord("Co-curricular", "Form 4", null, null, null, null),
                new CanonicalRecord("Misc", "Football team captain", null, null, null, null),
                new CanonicalRecord("Misc", "Well done this term", null, null, null, null),
                new CanonicalRecord("Student Details", "School Club: None", null, null, null, null),
                new CanonicalRecord("Subjects", "Chess Club", 90.0, null, null, null),
                new CanonicalRecord("Co-curricular", "Chess Club Member", null, null, null, null));

        assertThat(SubjectResolver.collectActivities(records)).containsExactly(
                "Chess Club Member", "Debate Society", "Red Crescent", "Football team captain");
    }

    @Test
    void activityTaggedAsStudentDetailsIsStillCollected() {
        List<CanonicalRecord> records = CanonicalRecordBuilder.fromText(
                "Co-curricular\nSchool Football Team Captain\nSchool: SMK Alpha Chess Club");

        assertThat(SubjectResolver.collectActivities(records)).containsExactly("School Football Team Captain");
    }

    @Test
    void sectionContainingSubjectsCounts() {
        List<CanonicalRecord> records = Arrays.asList(
                new CanonicalRecord("Academic Subjects", "Mathematics", 82.0, 100.0, null, null),
                new CanonicalRecord("academic subjects", "History", 67.0, 100.0, null, null));

        assertThat(SubjectResolver.resolve(records).scores)
                .containsExactly(entry("Mathematics", 82.0), entry("History", 67.0));
    }
}
