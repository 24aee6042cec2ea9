package com.cityvibe.dedup;

import com.cityvibe.domain.EventDraft;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.StringLength;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@Label("Signature and fuzzy matching properties")
class DeduplicationPropertiesTest {

    private static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");

    private static EventDraft draft(String title, Instant start, String venue) {
        EventDraft draft = new EventDraft(0);
        draft.setTitle(title);
        draft.setStartTime(start);
        draft.setVenueId(venue);
        return draft;
    }

    @Provide
    Arbitrary<String> titles() {
        return Arbitraries.strings().withCharRange('a', 'z').withChars(' ', 'A', 'Z', 'J').ofMinLength(1).ofMaxLength(30)
            .filter(s -> !s.isBlank());
    }

    @Provide
    Arbitrary<String> venues() {
        return Arbitraries.of("venue-1", "venue-2");
    }

    @Property
    @Label("equal signature inputs give equal signatures")
    void equalInputsGiveEqualSignatures(
            @ForAll("titles") String title,
            @ForAll @LongRange(min = 0, max = 100_000_000) long offsetSeconds,
            @ForAll("venues") String venue) {
        Instant start = BASE.plusSeconds(offsetSeconds);

        assertThat(EventSignature.of(draft(title, start, venue)))
            .isEqualTo(EventSignature.of(draft(new String(title.toCharArray()), start, venue)));
    }

    @Property
    @Label("case and surrounding whitespace never change the signature")
    void signatureIgnoresCaseAndPadding(
            @ForAll @AlphaChars @StringLength(min = 1, max = 30) String title,
            @ForAll @LongRange(min = 0, max = 59) long seconds) {
        Instant start = BASE.plus(Duration.ofHours(20));

        assertThat(EventSignature.of("  " + title.toUpperCase() + " ", start.plusSeconds(seconds), "venue-1"))
            .isEqualTo(EventSignature.of(title.toLowerCase(), start, "venue-1"));
    }

    @Property
    @Label("fuzzy matching is symmetric in both time window modes")
    void fuzzyMatchIsSymmetric(
            @ForAll("titles") String titleA,
            @ForAll("titles") String titleB,
            @ForAll @LongRange(min = 0, max = 500_000) long startA,
            @ForAll @LongRange(min = 0, max = 500_000) long startB,
            @ForAll("venues") String venueA,
            @ForAll("venues") String venueB,
            @ForAll boolean toleranceMode) {
        FuzzyMatcher matcher = new FuzzyMatcher(new DeduplicationSettings(
            0.85,
            toleranceMode ? DeduplicationSettings.TimeWindow.TOLERANCE : DeduplicationSettings.TimeWindow.SAME_DAY,
            Duration.ofHours(3),
            ZoneOffset.UTC,
            Duration.ofDays(30),
            5000));
        EventDraft a = draft(titleA, BASE.plusSeconds(startA), venueA);
        EventDraft b = draft(titleB, BASE.plusSeconds(startB), venueB);

        assertThat(matcher.matches(a, b)).isEqualTo(matcher.matches(b, a));
    }

    @Property
    @Label("title similarity is symmetric and bounded")
    void similarityIsSymmetricAndBounded(@ForAll("titles") String a, @ForAll("titles") String b) {
        double ab = TitleSimilarity.ratio(a, b);

        assertThat(ab).isEqualTo(TitleSimilarity.ratio(b, a));
        assertThat(ab).isBetween(0.0, 1.0);
    }
}
