package com.moviz.pipeline;

import java.util.List;

/**
 * The three finished tables of one run, handed to storage as a single referentially consistent set.
 */
public record RelationalSchema(List<Movie> movies, List<Genre> genres, List<MovieGenre> movieGenres) {
    public RelationalSchema {
        movies = List.copyOf(movies);
        genres = List.copyOf(genres);
        movieGenres = List.copyOf(movieGenres);
    }
}
