package com.moviz.pipeline;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AugmenterTest {

    @Test
    void testDecadeOf() {
        assertEquals(1990, Augmenter.decadeOf(1999));
        assertEquals(2000, Augmenter.decadeOf(2000));
        assertEquals(1880, Augmenter.decadeOf(1880));
        assertEquals(2020, Augmenter.decadeOf(2025));
    }

    @Test
    void testAugmentSetsDecade() {
        NormalizedRecord record = Records.metadata(1, "tt1", "The Matrix", 1999).build().withDecade(0);
        List<NormalizedRecord> augmented = new Augmenter().augment(List.of(record));
        assertEquals(1990, augmented.get(0).decade());
        assertEquals(record.normalizedTitle(), augmented.get(0).normalizedTitle());
    }

    @Test
    void testRecordWithoutYearKeepsNullDecade() {
        NormalizedRecord record = Records.genres(1, "42", null, 2000, "Action").year(null).build();
        List<NormalizedRecord> augmented = new Augmenter().augment(List.of(record));
        assertNull(augmented.get(0).decade());
        assertEquals(List.of("Action"), augmented.get(0).genres());
    }
}
