package com.moviz.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Sequences the pipeline stages and hands the finished tables to storage.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Loads the metadata, genre and financial datasets through {@link CsvServiceInterface}.</li>
 *   <li>Checks every dataset header before any row is touched, so a structural problem aborts the run
 *       with nothing written.</li>
 *   <li>Per dataset: {@link Normalizer}, {@link QualityFilter}, {@link Deduplicator}, {@link Augmenter}.</li>
 *   <li>Cross-dataset: {@link EntityResolver}, then {@link SchemaBuilder}.</li>
 *   <li>Writes the three tables through {@link PostgresServiceInterface} in one atomic step, then exports
 *       the processed CSVs when enabled.</li>
 * </ul>
 * A run is single-threaded and keeps no state between runs; every stage consumes its complete input.
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public class MovieDataPipeline {
    private static final Logger logger = LoggerFactory.getLogger(MovieDataPipeline.class);

    private final CsvServiceInterface csvService;
    private final PostgresServiceInterface postgresService;
    private final Normalizer normalizer;
    private final QualityFilter qualityFilter;
    private final Deduplicator deduplicator;
    private final Augmenter augmenter;
    private final EntityResolver entityResolver;
    private final SchemaBuilder schemaBuilder;

    public MovieDataPipeline(CsvServiceInterface csvService, PostgresServiceInterface postgresService, Normalizer normalizer,
                             QualityFilter qualityFilter, Deduplicator deduplicator, Augmenter augmenter,
                             EntityResolver entityResolver, SchemaBuilder schemaBuilder) {
        this.csvService = csvService;
        this.postgresService = postgresService;
        this.normalizer = normalizer;
        this.qualityFilter = qualityFilter;
        this.deduplicator = deduplicator;
        this.augmenter = augmenter;
        this.entityResolver = entityResolver;
        this.schemaBuilder = schemaBuilder;
    }

    /**
     * Wires the default stages with the bundled lookup tables.
     */
    public static MovieDataPipeline create(CsvServiceInterface csvService, PostgresServiceInterface postgresService) {
        return new MovieDataPipeline(csvService, postgresService,
            new Normalizer(LookupTables.certificateMapper(), LookupTables.genreMapper()),
            new QualityFilter(), new Deduplicator(), new Augmenter(), new EntityResolver(), new SchemaBuilder());
    }

    /**
     * Runs the whole pipeline: load, process, store, export.
     * @param config input paths and output settings
     * @return the run report
     * @throws MissingColumnException if a dataset lacks a required column
     * @throws PipelineException if an input cannot be read or the tables cannot be stored
     */
    public PipelineReport run(PipelineConfig config) {
        RawDataset metadata = load(Dataset.METADATA, config.metadataPath());
        RawDataset genres = load(Dataset.GENRES, config.genresPath());
        RawDataset financial = load(Dataset.FINANCIAL, config.financialPath());

        PipelineResult result = process(metadata, genres, financial);

        postgresService.writeSchema(result.schema());
        if (config.exportCsv()) {
            export(result, config.outputDir());
        }
        logger.info(result.report().summary());
        return result.report();
    }

    /**
     * Runs the cleaning and resolution stages in memory.
     * @return the relational tables and the report; nothing is written
     * @throws MissingColumnException if a dataset lacks a required column
     */
    public PipelineResult process(RawDataset metadata, RawDataset genres, RawDataset financial) {
        for (RawDataset raw : List.of(metadata, genres, financial)) {
            normalizer.resolveHeader(raw);
        }

        Map<Dataset, PipelineReport.DatasetSummary> summaries = new EnumMap<>(Dataset.class);
        List<Rejection> rejections = new ArrayList<>();
        List<NormalizedRecord> cleanMetadata = clean(metadata, summaries, rejections);
        List<NormalizedRecord> cleanGenres = clean(genres, summaries, rejections);
        List<NormalizedRecord> cleanFinancial = clean(financial, summaries, rejections);

        EntityResolver.ResolutionResult resolution = entityResolver.resolve(cleanMetadata, cleanGenres, cleanFinancial);
        RelationalSchema schema = schemaBuilder.build(resolution.movies());

        PipelineReport report = new PipelineReport(summaries, PipelineReport.countByReason(rejections), rejections,
            resolution.stats(), schema.movies().size(), schema.genres().size(), schema.movieGenres().size());
        return new PipelineResult(schema, report);
    }

    private List<NormalizedRecord> clean(RawDataset raw, Map<Dataset, PipelineReport.DatasetSummary> summaries,
                                         List<Rejection> rejections) {
        Normalizer.NormalizationResult normalized = normalizer.normalizeAll(raw);
        QualityFilter.FilterResult filtered = qualityFilter.filter(normalized.records());
        Deduplicator.DedupResult deduplicated = deduplicator.deduplicate(filtered.accepted());
        List<NormalizedRecord> augmented = augmenter.augment(deduplicated.records());

        rejections.addAll(normalized.rejections());
        rejections.addAll(filtered.rejections());
        int rejected = normalized.rejections().size() + filtered.rejections().size();
        summaries.put(raw.dataset(), new PipelineReport.DatasetSummary(raw.rows().size(), rejected,
            deduplicated.removed(), augmented.size()));
        logger.info("Cleaned '{}': {} loaded, {} rejected, {} duplicates, {} remaining", raw.dataset().sourceName(),
            raw.rows().size(), rejected, deduplicated.removed(), augmented.size());
        return augmented;
    }

    private RawDataset load(Dataset dataset, Path source) {
        try {
            return csvService.readDataset(dataset, source);
        } catch (IOException e) {
            logger.error("Failed to read '{}' dataset from {}: {}", dataset.sourceName(), source, e.getMessage());
            throw new PipelineException("Failed to read " + dataset.sourceName() + " dataset from " + source, e);
        }
    }

    private void export(PipelineResult result, Path outputDir) {
        try {
            csvService.writeSchema(result.schema(), outputDir);
            csvService.writeRejections(result.report().rejections(), outputDir);
        } catch (IOException e) {
            logger.error("Failed to export processed CSVs to {}: {}", outputDir, e.getMessage());
            throw new PipelineException("Failed to export processed CSVs to " + outputDir, e);
        }
    }
}
