package com.example.reportcard.util.behaviour;

import com.example.reportcard.util.behaviour.dto.Rating;
import com.example.reportcard.util.record.dto.CanonicalRecord;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class BehaviourExtractorTest {

    @Test
    void structuredRecordsWin() {
        List<CanonicalRecord> records = Arrays.asList(
                new CanonicalRecord("Behaviour", "punctuality", null, null, "Very Good", null),
                new CanonicalRecord("Behavior Ratings", "Homework", null, null, "g00d", null),
                new CanonicalRecord("Subjects", "Mathematics", 88.0, 100.0, null, null));

        Map<String, Rating> result = BehaviourExtractor.extract(records, "Attentiveness Excellent");

        assertThat(result).containsExactly(
                entry("Punctuality", Rating.VERY_GOOD),
                entry("Homework", Rating.GOOD));
    }

    @Test
    void fallsBackToTextWhenNoStructuredRatings() {
        Map<String, Rating> result = BehaviourExtractor.extract(Collections.<CanonicalRecord>emptyList(),
                "Attentiveness: Good\nClass Participation - Excellent");

        assertThat(result).containsExactly(
                entry("Attentiveness", Rating.GOOD),
                entry("Class Participation", Rating.EXCELLENT));
    }

    @Test
    void strictPassHandlesSeveralPairsOnOneLine() {
        Map<String, Rating> result = BehaviourExtractor.fromText("Attentiveness Good Punctuality Excellent");

        assertThat(result).containsExactly(
                entry("Attentiveness", Rating.GOOD),
                entry("Punctuality", Rating.EXCELLENT));
    }

    @Test
    void acceptsOcrVariantsInText() {
        assertThat(BehaviourExtractor.fromText("Discipline g00d")).containsExactly(entry("Discipline", Rating.GOOD));
    }

    @Test
    void keepsOnlyLeftSegmentOfPipedLines() {
        Map<String, Rating> result = BehaviourExtractor.fromText("Neatness Fair | Chess Club Excellent");

        assertThat(result).containsOnlyKeys("Neatness");
    }

    @Test
    void attributesWithDigitsAreExcluded() {
        List<CanonicalRecord> records = Collections.singletonList(
                new CanonicalRecord("Behaviour", "Term 2 Conduct", null, null, "Good", null));

        assertThat(BehaviourExtractor.extract(records, null)).isEmpty();
    }

    @Test
    void unknownRatingsAreDropped() {
        List<CanonicalRecord> records = Collections.singletonList(
                new CanonicalRecord("Behaviour", "Teamwork", null, null, "superb", null));

        assertThat(BehaviourExtractor.fromRecords(records)).isEmpty();
    }

    @Test
    void groupsAttributesByRating() {
        Map<String, List<String>> grouped = BehaviourExtractor.groupByRating(
                BehaviourExtractor.fromText("Attentiveness Good\nPunctuality Excellent\nNeatness Good"));

        assertThat(grouped).containsOnlyKeys("Good", "Excellent");
        assertThat(grouped.get("Good")).containsExactly("Attentiveness", "Neatness");
    }

    @Test
    void cleansAttributeNoise() {
        assertThat(BehaviourExtractor.cleanAttribute("class  participation*")).isEqualTo("Class Participation");
    }

    @Test
    void backwardWalkSkipsScoreTokens() {
        assertThat(BehaviourExtractor.fromText("Attentiveness 3/5 Good"))
                .containsExactly(entry("Attentiveness", Rating.GOOD));
    }

    @Test
    void backwardWalkStopsAtPreviousRating() {
        Map<String, Rating> result = BehaviourExtractor.fromText("Punctuality 4/5 Good Teamwork 3/5 Fair");

        assertThat(result).containsExactly(
                entry("Punctuality", Rating.GOOD),
                entry("Teamwork", Rating.FAIR));
    }
}
