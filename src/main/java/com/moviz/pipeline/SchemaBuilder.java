package com.moviz.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds the three relational tables from resolved movies.
 * <p>
 * Genre names are already canonical, so two labels that differ only in case or spacing are the same
 * genre. Genre ids are assigned from 1 in first-occurrence order over the movies and their labels.
 * Each (movie, genre) pair appears once.
 */
public class SchemaBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SchemaBuilder.class);

    public RelationalSchema build(List<ResolvedMovie> resolved) {
        List<Movie> movies = new ArrayList<>(resolved.size());
        Map<String, Genre> genresByKey = new LinkedHashMap<>();
        LinkedHashSet<MovieGenre> links = new LinkedHashSet<>();

        for (ResolvedMovie entry : resolved) {
            Movie movie = entry.movie();
            movies.add(movie);
            for (String label : entry.genreLabels()) {
                if (Utils.isBlank(label)) continue;
                String key = GenreMapper.key(label);
                Genre genre = genresByKey.get(key);
                if (genre == null) {
                    genre = new Genre(genresByKey.size() + 1, label.trim());
                    genresByKey.put(key, genre);
                }
                links.add(new MovieGenre(movie.movieId(), genre.genreId()));
            }
        }

        RelationalSchema schema = new RelationalSchema(movies, new ArrayList<>(genresByKey.values()), new ArrayList<>(links));
        logger.info("Built schema: {} movies, {} genres, {} movie-genre links", movies.size(),
            schema.genres().size(), schema.movieGenres().size());
        return schema;
    }
}
