package com.example.reportcard.util.parse;

import com.example.reportcard.util.parse.dto.ScoreLine;
import com.example.reportcard.util.parse.dto.TaggedLine;
import com.example.reportcard.util.record.dto.ReportSection;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SectionClassifierTest {

    @Test
    void headersMoveCursorAndProduceNoLines() {
        List<TaggedLine> tagged = SectionClassifier.classify(Arrays.asList(
                "Student Details",
                "Name: Ahmad Daniel",
                "Subjects",
                "Mathematics 88/100",
                "Behaviour",
                "Punctuality: Very Good"));

        assertThat(tagged).hasSize(3);
        assertThat(tagged.get(0).kind).isEqualTo(TaggedLine.Kind.METADATA);
        assertThat(tagged.get(0).section).isEqualTo(ReportSection.STUDENT_DETAILS);
        assertThat(tagged.get(1).kind).isEqualTo(TaggedLine.Kind.SCORE);
        assertThat(tagged.get(1).section).isEqualTo(ReportSection.SUBJECTS);
        assertThat(tagged.get(2).kind).isEqualTo(TaggedLine.Kind.RATING);
        assertThat(tagged.get(2).ratingLabel).isEqualTo("Punctuality");
        assertThat(tagged.get(2).ratingValue).isEqualTo("Very Good");
    }

    @Test
    void metadataLineWithEmbeddedScoreEmitsBoth() {
        List<TaggedLine> tagged = SectionClassifier.classify(
                Collections.singletonList("Name Arif Bin Hassan Languages 74/100"));

        assertThat(tagged).hasSize(2);
        assertThat(tagged.get(0).kind).isEqualTo(TaggedLine.Kind.METADATA);
        assertThat(tagged.get(1).kind).isEqualTo(TaggedLine.Kind.SCORE);
        assertThat(tagged.get(1).score.label).isEqualTo("Languages");
        assertThat(tagged.get(1).score.score).isEqualTo(74);
        assertThat(tagged.get(1).score.maximum).isEqualTo(100);
    }

    @Test
    void embeddedScoreRejectsMetadataLabels() {
        ScoreLine embedded = SectionClassifier.extractEmbeddedScore("Attendance 180/190");

        assertThat(embedded).isNull();
    }

    @Test
    void joinsLabelAndScoreSplitAcrossTwoLines() {
        List<TaggedLine> tagged = SectionClassifier.classify(Arrays.asList("Mathematics", "88/100"));

        assertThat(tagged).hasSize(1);
        assertThat(tagged.get(0).kind).isEqualTo(TaggedLine.Kind.SCORE);
        assertThat(tagged.get(0).lineCount).isEqualTo(2);
        assertThat(tagged.get(0).score.label).isEqualTo("Mathematics");
        assertThat(tagged.get(0).score.score).isEqualTo(88);
    }

    @Test
    void scoresUnderBehaviourHeaderStayInBehaviour() {
        List<TaggedLine> tagged = SectionClassifier.classify(Arrays.asList("Behaviour", "Effort 4/5"));

        assertThat(tagged).hasSize(1);
        assertThat(tagged.get(0).kind).isEqualTo(TaggedLine.Kind.SCORE);
        assertThat(tagged.get(0).section).isEqualTo(ReportSection.BEHAVIOUR);
    }

    @Test
    void headerWithColonReclassifiesRemainder() {
        List<TaggedLine> tagged = SectionClassifier.classify(
                Collections.singletonList("Co-curricular: Chess Club"));

        assertThat(tagged).hasSize(1);
        assertThat(tagged.get(0).kind).isEqualTo(TaggedLine.Kind.MISC);
        assertThat(tagged.get(0).section).isEqualTo(ReportSection.CO_CURRICULAR);
        assertThat(tagged.get(0).text).isEqualTo("Chess Club");
    }

    @Test
    void miscLinesWithoutCursorFallBackByKeyword() {
        List<TaggedLine> tagged = SectionClassifier.classify(Arrays.asList(
                "Debate Club Member",
                "Well done this term"));

        assertThat(tagged).extracting(t -> t.section)
                .containsExactly(ReportSection.CO_CURRICULAR, ReportSection.MISC);
    }

    @Test
    void ratingLinesWithDigitsAreNotRatings() {
        List<TaggedLine> tagged = SectionClassifier.classify(Collections.singletonList("Discipline g00d"));

        assertThat(tagged).hasSize(1);
        assertThat(tagged.get(0).kind).isEqualTo(TaggedLine.Kind.MISC);
    }

    @Test
    void blankAndNullInputs() {
        assertThat(SectionClassifier.classify(null)).isEmpty();
        assertThat(SectionClassifier.classify(Arrays.asList("", "   "))).isEmpty();
    }
}
