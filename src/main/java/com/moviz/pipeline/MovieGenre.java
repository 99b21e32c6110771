package com.moviz.pipeline;

/**
 * One row of the {@code movie_genre} association table.
 */
public record MovieGenre(long movieId, int genreId) {}
