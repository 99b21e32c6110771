package com.moviz.pipeline;

import java.util.*;

/**
 * Test fixtures: normalized records, movies and raw datasets without going through CSV files.
 */
final class Records {
    private Records() {}

    static Builder metadata(int row, String id, String title, int year) {
        return new Builder(Dataset.METADATA, row).id(id).title(title).year(year);
    }

    static Builder genres(int row, String id, String title, int year, String... labels) {
        return new Builder(Dataset.GENRES, row).id(id).title(title).year(year).genres(labels);
    }

    static Builder financial(int row, String title, int year, Long budget) {
        return new Builder(Dataset.FINANCIAL, row).title(title).year(year).budget(budget);
    }

    static Movie movie(long id, String title, int year) {
        return new Movie(id, null, title, TitleNormalizer.normalize(title), year, Augmenter.decadeOf(year), null,
            null, null, null, null, null, null, null, EnumSet.of(Dataset.METADATA));
    }

    /**
     * Raw dataset from a header and rows given as cell arrays; row numbers start at 1.
     */
    static RawDataset raw(Dataset dataset, List<String> header, String[]... rows) {
        List<RawRecord> records = new ArrayList<>();
        for (String[] cells : rows) {
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                values.put(header.get(i), i < cells.length ? cells[i] : null);
            }
            records.add(new RawRecord(dataset, records.size() + 1, values));
        }
        return new RawDataset(dataset, header, records);
    }

    static final class Builder {
        private final Dataset dataset;
        private final int row;
        private String id;
        private String title;
        private Integer year;
        private Double rating;
        private Certificate certificate;
        private List<String> genres = List.of();
        private Long budget;
        private Long worldwideGross;
        private String description;

        Builder(Dataset dataset, int row) {
            this.dataset = dataset;
            this.row = row;
        }

        Builder id(String id) { this.id = id; return this; }
        Builder title(String title) { this.title = title; return this; }
        Builder year(Integer year) { this.year = year; return this; }
        Builder rating(Double rating) { this.rating = rating; return this; }
        Builder certificate(Certificate certificate) { this.certificate = certificate; return this; }
        Builder genres(String... labels) { this.genres = List.of(labels); return this; }
        Builder budget(Long budget) { this.budget = budget; return this; }
        Builder worldwideGross(Long gross) { this.worldwideGross = gross; return this; }
        Builder description(String description) { this.description = description; return this; }

        NormalizedRecord build() {
            Map<String, String> columns = new LinkedHashMap<>();
            if (dataset != Dataset.FINANCIAL) columns.put(ColumnRegistry.RAW_ID, id);
            columns.put(ColumnRegistry.TITLE, title);
            columns.put(ColumnRegistry.RELEASE_DATE, year == null ? null : year.toString());
            return new NormalizedRecord(dataset, row, id, title, TitleNormalizer.normalize(title), year,
                year == null ? null : Augmenter.decadeOf(year), null, rating, null, null, null, certificate, genres,
                budget, null, worldwideGross, false, null, description, columns);
        }
    }
}
