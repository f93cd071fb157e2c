package com.example.reportcard.util.parse;

import com.example.reportcard.util.parse.dto.ScoreLine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreLineParserTest {

    @Test
    void parsesSlashFormat() {
        ScoreLine line = ScoreLineParser.parse("Mathematics 88/100");

        assertThat(line).isNotNull();
        assertThat(line.label).isEqualTo("Mathematics");
        assertThat(line.score).isEqualTo(88);
        assertThat(line.maximum).isEqualTo(100);
        assertThat(line.format).isEqualTo(ScoreLine.Format.SLASH);
    }

    @Test
    void parsesOfFormatWithSeparator() {
        ScoreLine line = ScoreLineParser.parse("English: 74 of 100");

        assertThat(line).isNotNull();
        assertThat(line.label).isEqualTo("English");
        assertThat(line.score).isEqualTo(74);
        assertThat(line.maximum).isEqualTo(100);
        assertThat(line.format).isEqualTo(ScoreLine.Format.OF);
    }

    @Test
    void parsesScoreWithoutMaximum() {
        ScoreLine line = ScoreLineParser.parse("Science - 91");

        assertThat(line).isNotNull();
        assertThat(line.label).isEqualTo("Science");
        assertThat(line.score).isEqualTo(91);
        assertThat(line.maximum).isNull();
        assertThat(line.format).isEqualTo(ScoreLine.Format.SCORE_ONLY);
    }

    @Test
    void stripsTrailingScoreWordFromLabel() {
        ScoreLine line = ScoreLineParser.parse("Mathematics Score: 88");

        assertThat(line).isNotNull();
        assertThat(line.label).isEqualTo("Mathematics");
    }

    @Test
    void rejectsLinesWithoutLabel() {
        assertThat(ScoreLineParser.parse("74 / 100")).isNull();
        assertThat(ScoreLineParser.parse("")).isNull();
        assertThat(ScoreLineParser.parse(null)).isNull();
    }

    @Test
    void rejectsOverlongNumbers() {
        assertThat(ScoreLineParser.parse("Score: 5000")).isNull();
    }

    @Test
    void parseWithMaximumIgnoresBareNumbers() {
        assertThat(ScoreLineParser.parseWithMaximum("Form 4")).isNull();
        assertThat(ScoreLineParser.parseWithMaximum("History 65/100").maximum).isEqualTo(100);
    }

    @Test
    void trailingIntegerFallback() {
        ScoreLine line = ScoreLineParser.parseTrailingInteger("Position in class 12");

        assertThat(line).isNotNull();
        assertThat(line.label).isEqualTo("Position in class");
        assertThat(line.score).isEqualTo(12);
        assertThat(line.format).isEqualTo(ScoreLine.Format.TRAILING_INTEGER);
        assertThat(ScoreLineParser.parseTrailingInteger("no digits here")).isNull();
    }

    @Test
    void cleanLabelReturnsNullWhenNothingLeft() {
        assertThat(ScoreLineParser.cleanLabel("Marks: ")).isNull();
        assertThat(ScoreLineParser.cleanLabel(" Biology - ")).isEqualTo("Biology");
    }
}
