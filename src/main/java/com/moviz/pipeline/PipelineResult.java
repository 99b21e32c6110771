package com.moviz.pipeline;

/**
 * In-memory result of processing the three datasets, before anything is written.
 */
public record PipelineResult(RelationalSchema schema, PipelineReport report) {}
