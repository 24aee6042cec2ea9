package com.cityvibe.validation;

import com.cityvibe.domain.EventDraft;
import com.cityvibe.venue.VenueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Structural and semantic validation of event drafts.
 *
 * Every rule is evaluated for every draft so callers get complete diagnostics.
 * Reasons take the form {@code rule_name: detail} and are also attached to the draft.
 */
@Component
public class EventValidator {

    private static final Logger log = LoggerFactory.getLogger(EventValidator.class);

    public static final String TITLE_REQUIRED = "title_required";
    public static final String VENUE_UNRESOLVED = "venue_unresolved";
    public static final String END_BEFORE_START = "end_before_start";
    public static final String PRICE_RANGE_INVERTED = "price_range_inverted";
    public static final String SOURCE_URL_INVALID = "source_url_invalid";

    private final List<ValidationRule> rules;

    public EventValidator(VenueRegistry venueRegistry) {
        this.rules = List.of(
            rule(TITLE_REQUIRED, draft ->
                draft.getTitle() == null || draft.getTitle().isBlank()
                    ? "title is missing or blank" : null),
            rule(VENUE_UNRESOLVED, draft -> {
                if (draft.getVenueId() == null || draft.getVenueId().isBlank()) {
                    return "venue_id is missing";
                }
                return venueRegistry.isResolvable(draft.getVenueId())
                    ? null : "venue '" + draft.getVenueId() + "' is not registered";
            }),
            rule(END_BEFORE_START, draft ->
                draft.getStartTime() != null && draft.getEndTime() != null
                    && draft.getEndTime().isBefore(draft.getStartTime())
                    ? "end_time " + draft.getEndTime() + " is before start_time " + draft.getStartTime()
                    : null),
            rule(PRICE_RANGE_INVERTED, draft ->
                draft.getPriceMin() != null && draft.getPriceMax() != null
                    && draft.getPriceMin().compareTo(draft.getPriceMax()) > 0
                    ? "price_min " + draft.getPriceMin().toPlainString()
                        + " exceeds price_max " + draft.getPriceMax().toPlainString()
                    : null),
            rule(SOURCE_URL_INVALID, draft ->
                draft.getSourceUrl() != null && !isAbsoluteUrl(draft.getSourceUrl())
                    ? "'" + draft.getSourceUrl() + "' is not an absolute URL" : null)
        );
    }

    /**
     * Validate a single draft; failing reasons are attached to the draft
     *
     * @param draft the draft to validate
     * @return ok, or rejected with every failing rule
     */
    public ValidationResult validate(EventDraft draft) {
        List<String> reasons = new ArrayList<>();
        for (ValidationRule rule : rules) {
            rule.check(draft).ifPresent(detail -> reasons.add(rule.getName() + ": " + detail));
        }

        if (reasons.isEmpty()) {
            return ValidationResult.ok();
        }

        reasons.forEach(draft::addRejectionReason);
        log.debug("Rejected record {}: {}", draft.getRecordIndex(), reasons);
        return ValidationResult.rejected(reasons);
    }

    /**
     * Partition a batch into valid and rejected drafts, preserving order on each side
     */
    public ValidationPartition validateBatch(List<EventDraft> drafts) {
        List<EventDraft> valid = new ArrayList<>();
        List<EventDraft> rejected = new ArrayList<>();
        for (EventDraft draft : drafts) {
            if (validate(draft).isValid()) {
                valid.add(draft);
            } else {
                rejected.add(draft);
            }
        }
        return new ValidationPartition(valid, rejected);
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    static boolean isAbsoluteUrl(String value) {
        try {
            URI uri = new URI(value);
            return uri.isAbsolute() && uri.getHost() != null && !uri.getHost().isBlank();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static ValidationRule rule(String name, Function<EventDraft, String> failure) {
        return new ValidationRule() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Optional<String> check(EventDraft draft) {
                return Optional.ofNullable(failure.apply(draft));
            }
        };
    }
}
