package com.example.reportcard.util.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextUtilsTest {

    @Test
    void normalizesOcrText() {
        String raw = "Name:\u00A0H e l e n e\u200B  Tan\r\n\r\n\r\nSubjects";

        assertThat(TextUtils.normalizeOcrText(raw)).isEqualTo("Name: Helene Tan\n\nSubjects");
    }

    @Test
    void titleCaseHandlesApostrophes() {
        assertThat(TextUtils.titleCase("class participation")).isEqualTo("Class Participation");
        assertThat(TextUtils.titleCase("o'neil")).isEqualTo("O'Neil");
    }

    @Test
    void tableMissingMarkersAreBlank() {
        assertThat(TextUtils.isBlank("NaN")).isTrue();
        assertThat(TextUtils.isBlank(" none ")).isTrue();
        assertThat(TextUtils.isBlank("0")).isFalse();
    }

    @Test
    void truncatesForLogs() {
        assertThat(TextUtils.truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(TextUtils.truncate(null, 3)).isEmpty();
    }
}
