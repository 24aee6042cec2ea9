package com.cityvibe.validation;

import com.cityvibe.domain.EventDraft;
import com.cityvibe.domain.VenueConfig;
import com.cityvibe.venue.VenueRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.BigRange;
import net.jqwik.api.constraints.Scale;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@Label("Price range validation properties")
class PriceRangePropertiesTest {

    private final EventValidator validator = newValidator();

    private static EventValidator newValidator() {
        VenueRegistry registry = new VenueRegistry(new ObjectMapper(), "");
        registry.register(VenueConfig.of("venue-1"));
        return new EventValidator(registry);
    }

    private static EventDraft draftWithPrices(BigDecimal min, BigDecimal max) {
        EventDraft draft = new EventDraft(0);
        draft.setTitle("Concert");
        draft.setVenueId("venue-1");
        draft.setPriceMin(min);
        draft.setPriceMax(max);
        return draft;
    }

    @Property
    @Label("every draft with price_min > price_max is rejected for the price range")
    void invertedRangeIsAlwaysRejected(
            @ForAll @BigRange(min = "0", max = "10000") @Scale(2) BigDecimal a,
            @ForAll @BigRange(min = "0", max = "10000") @Scale(2) BigDecimal b) {
        BigDecimal min = a.max(b);
        BigDecimal max = a.min(b);
        if (min.compareTo(max) == 0) {
            min = min.add(BigDecimal.ONE);
        }

        ValidationResult result = validator.validate(draftWithPrices(min, max));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getReasons()).anyMatch(r -> r.startsWith(EventValidator.PRICE_RANGE_INVERTED));
    }

    @Property
    @Label("an ordered price range never triggers the price rule")
    void orderedRangeIsAccepted(
            @ForAll @BigRange(min = "0", max = "10000") @Scale(2) BigDecimal a,
            @ForAll @BigRange(min = "0", max = "10000") @Scale(2) BigDecimal b) {
        ValidationResult result = validator.validate(draftWithPrices(a.min(b), a.max(b)));

        assertThat(result.isValid()).isTrue();
    }
}
