package com.moviz.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * Derived columns applied uniformly to cleaned records. Currently the decade bucket, left null for a
 * record without a year (a genre record admitted on its identifier alone).
 */
public class Augmenter {

    /**
     * @param year release year
     * @return first year of the containing decade, e.g. 1999 gives 1990
     */
    public static int decadeOf(int year) {
        return year - year % 10;
    }

    public List<NormalizedRecord> augment(List<NormalizedRecord> records) {
        List<NormalizedRecord> augmented = new ArrayList<>(records.size());
        for (NormalizedRecord record : records) {
            augmented.add(record.year() == null ? record : record.withDecade(decadeOf(record.year())));
        }
        return augmented;
    }
}
