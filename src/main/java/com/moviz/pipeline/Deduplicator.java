package com.moviz.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Collapses duplicates within one dataset, keeping the first-seen record for each key.
 * <p>
 * Phase 1 drops records whose native identifier was already seen. Phase 2 runs over everything phase 1
 * kept and drops records whose fallback key {@code (normalizedTitle, year)} was already seen, which
 * catches the same film filed under two different identifiers. Both phases always run.
 */
public class Deduplicator {
    private static final Logger logger = LoggerFactory.getLogger(Deduplicator.class);

    /**
     * Deduplicated records plus how many each phase removed.
     */
    public record DedupResult(List<NormalizedRecord> records, int identifierDuplicates, int fallbackKeyDuplicates) {
        public DedupResult {
            records = List.copyOf(records);
        }

        public int removed() {
            return identifierDuplicates + fallbackKeyDuplicates;
        }
    }

    public DedupResult deduplicate(List<NormalizedRecord> records) {
        Set<String> seenIds = new HashSet<>();
        List<NormalizedRecord> afterIds = new ArrayList<>(records.size());
        int idDuplicates = 0;
        for (NormalizedRecord record : records) {
            if (record.hasRawId() && !seenIds.add(record.rawId())) {
                idDuplicates++;
                continue;
            }
            afterIds.add(record);
        }

        Set<FallbackKey> seenKeys = new HashSet<>();
        List<NormalizedRecord> kept = new ArrayList<>(afterIds.size());
        int keyDuplicates = 0;
        for (NormalizedRecord record : afterIds) {
            FallbackKey key = record.fallbackKey();
            if (key != null && !seenKeys.add(key)) {
                keyDuplicates++;
                continue;
            }
            kept.add(record);
        }

        if (!records.isEmpty()) {
            logger.info("Deduplicated '{}': {} by identifier, {} by normalized title and year, {} remaining",
                records.get(0).dataset().sourceName(), idDuplicates, keyDuplicates, kept.size());
        }
        return new DedupResult(kept, idDuplicates, keyDuplicates);
    }
}
