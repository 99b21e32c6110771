package com.moviz.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the static remapping tables (certificates, genres) from JSON classpath resources.
 * A missing or unreadable table is fatal: remapping without it would silently change merge outcomes.
 */
public final class LookupTables {
    private static final Logger logger = LoggerFactory.getLogger(LookupTables.class);

    public static final String CERTIFICATE_MAP = "/certificate-map.json";
    public static final String GENRE_MAP = "/genre-map.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LookupTables() {}

    public static CertificateMapper certificateMapper() {
        return new CertificateMapper(loadTable(CERTIFICATE_MAP));
    }

    public static GenreMapper genreMapper() {
        return new GenreMapper(loadTable(GENRE_MAP));
    }

    /**
     * Reads a flat JSON object of string to string.
     * @param resource classpath resource name
     * @return insertion-ordered table
     * @throws PipelineException if the resource is missing or malformed
     */
    public static Map<String, String> loadTable(String resource) {
        try (InputStream in = LookupTables.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new PipelineException("Lookup table not found on classpath: " + resource);
            }
            Map<String, String> table = MAPPER.readValue(in, new TypeReference<LinkedHashMap<String, String>>() {});
            logger.debug("Loaded {} entries from {}", table.size(), resource);
            return table;
        } catch (IOException e) {
            throw new PipelineException("Failed to read lookup table " + resource, e);
        }
    }
}
