package com.moviz.pipeline;

/**
 * One row of the {@code genre} lookup table.
 */
public record Genre(int genreId, String name) {}
