package com.moviz.pipeline;

import java.util.List;

/**
 * A resolved movie together with the canonical genre labels gathered from every contributing dataset,
 * metadata labels first.
 */
public record ResolvedMovie(Movie movie, List<String> genreLabels) {
    public ResolvedMovie {
        genreLabels = List.copyOf(genreLabels);
    }
}
