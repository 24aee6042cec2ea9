package com.cityvibe.dedup;

import com.cityvibe.domain.BatchError;
import com.cityvibe.domain.BatchStage;
import com.cityvibe.domain.DedupDecision;
import com.cityvibe.domain.DedupOutcome;
import com.cityvibe.domain.EventDraft;
import com.cityvibe.domain.PersistedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides for every valid draft of a batch whether it is new, an update of a catalog
 * event, or a duplicate of an earlier draft in the same batch.
 *
 * Checks run cheapest first:
 * 1. exact signature match against earlier drafts of the batch
 * 2. exact signature match against the catalog (index, then snapshot)
 * 3. fuzzy match against earlier drafts, then against snapshot events
 *
 * Duplicates always point at the root draft of their group, so chains collapse to the
 * first occurrence. Deduplication runs on a single thread per batch and only reads the
 * snapshot and the index.
 */
@Component
public class EventDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(EventDeduplicator.class);

    private final SignatureIndex signatureIndex;
    private final FuzzyMatcher fuzzyMatcher;

    public EventDeduplicator(SignatureIndex signatureIndex, DeduplicationSettings settings) {
        this.signatureIndex = signatureIndex;
        this.fuzzyMatcher = new FuzzyMatcher(settings);
    }

    public DeduplicationResult deduplicate(List<EventDraft> drafts, HistorySnapshot snapshot) {
        List<DedupOutcome> outcomes = new ArrayList<>(drafts.size());
        List<BatchError> skipped = new ArrayList<>();

        List<EventDraft> earlier = new ArrayList<>(drafts.size());
        Map<String, Integer> rootBySignature = new HashMap<>();
        Map<Integer, Integer> rootByIndex = new HashMap<>();

        for (EventDraft draft : drafts) {
            int index = draft.getRecordIndex();

            String signature;
            try {
                signature = signatureIndex.signatureOf(draft);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping record {} during deduplication: {}", index, e.getMessage());
                skipped.add(new BatchError(index, BatchStage.DEDUPLICATE, e.getMessage()));
                continue;
            }
            draft.setSignature(signature);

            DedupDecision decision = decide(draft, signature, earlier, rootBySignature, rootByIndex, snapshot);

            int root = decision.getKind() == DedupDecision.Kind.DUPLICATE_WITHIN_BATCH
                ? decision.getFirstIndex()
                : index;
            rootByIndex.put(index, root);
            rootBySignature.putIfAbsent(signature, root);
            earlier.add(draft);

            log.debug("Record {} ('{}') -> {}", index, draft.getTitle(), decision);
            outcomes.add(new DedupOutcome(draft, decision));
        }

        return new DeduplicationResult(outcomes, skipped);
    }

    private DedupDecision decide(
            EventDraft draft,
            String signature,
            List<EventDraft> earlier,
            Map<String, Integer> rootBySignature,
            Map<Integer, Integer> rootByIndex,
            HistorySnapshot snapshot) {

        Integer exactRoot = rootBySignature.get(signature);
        if (exactRoot != null) {
            return DedupDecision.duplicateWithinBatch(exactRoot, DedupDecision.Match.EXACT);
        }

        Optional<String> existing = signatureIndex.lookup(signature);
        if (existing.isEmpty()) {
            existing = snapshot.idForSignature(signature);
        }
        if (existing.isPresent()) {
            return DedupDecision.updateOf(existing.get(), DedupDecision.Match.EXACT);
        }

        for (EventDraft candidate : earlier) {
            if (fuzzyMatcher.matches(draft, candidate)) {
                int root = rootByIndex.get(candidate.getRecordIndex());
                return DedupDecision.duplicateWithinBatch(root, DedupDecision.Match.FUZZY);
            }
        }

        for (PersistedEvent event : snapshot.getEvents()) {
            if (fuzzyMatcher.matches(draft, event)) {
                return DedupDecision.updateOf(event.getId(), DedupDecision.Match.FUZZY);
            }
        }

        return DedupDecision.newEvent();
    }
}
