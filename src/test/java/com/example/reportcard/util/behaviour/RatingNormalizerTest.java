package com.example.reportcard.util.behaviour;

import com.example.reportcard.util.behaviour.dto.Rating;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RatingNormalizerTest {

    @Test
    void exactMatchIgnoresCase() {
        assertThat(RatingNormalizer.normalize("EXCELLENT")).isEqualTo(Rating.EXCELLENT);
        assertThat(RatingNormalizer.normalize("very   good")).isEqualTo(Rating.VERY_GOOD);
    }

    @Test
    void variantsAndSynonyms() {
        assertThat(RatingNormalizer.normalize("G00D")).isEqualTo(Rating.GOOD);
        assertThat(RatingNormalizer.normalize("avg")).isEqualTo(Rating.FAIR);
        assertThat(RatingNormalizer.normalize("Satisfactory")).isEqualTo(Rating.GOOD);
        assertThat(RatingNormalizer.normalize("b@d")).isEqualTo(Rating.BAD);
    }

    @Test
    void repairsOcrConfusionsBeforeLookup() {
        assertThat(RatingNormalizer.repairOcrConfusions("exce11ent")).isEqualTo("excellent");
        assertThat(RatingNormalizer.normalize("Exce11ent")).isEqualTo(Rating.EXCELLENT);
        assertThat(RatingNormalizer.normalize("Po0r")).isEqualTo(Rating.POOR);
    }

    @Test
    void substringFallbackPrefersVeryGood() {
        assertThat(RatingNormalizer.normalize("very good!")).isEqualTo(Rating.VERY_GOOD);
        assertThat(RatingNormalizer.normalize("goodish")).isEqualTo(Rating.GOOD);
    }

    @Test
    void unknownTokensAreDropped() {
        assertThat(RatingNormalizer.normalize("xyz")).isNull();
        assertThat(RatingNormalizer.normalize("  ")).isNull();
        assertThat(RatingNormalizer.normalize(null)).isNull();
    }

    @Test
    void normalizationIsIdempotent() {
        for (String token : new String[]{"g00d", "Very Good", "avg", "Exce11ent", "poor", "B4D"}) {
            Rating once = RatingNormalizer.normalize(token);
            assertThat(RatingNormalizer.normalize(once.getLabel())).isEqualTo(once);
        }
    }

    @Test
    void recognisesRatingTokens() {
        assertThat(RatingNormalizer.isRatingToken("Good")).isTrue();
        assertThat(RatingNormalizer.isRatingToken("okay")).isTrue();
        assertThat(RatingNormalizer.isRatingToken("Punctuality")).isFalse();
    }
}
