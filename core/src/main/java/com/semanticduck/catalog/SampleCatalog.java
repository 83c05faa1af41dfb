package com.semanticduck.catalog;

import com.semanticduck.exception.CatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

/**
 * The bundled request/semantic-layer samples over the order and order-item
 * tables of an e-commerce dataset.
 */
public final class SampleCatalog {

    private static final Logger logger = LoggerFactory.getLogger(SampleCatalog.class);

    /** Classpath location of the bundled samples. */
    public static final String RESOURCE = "/samples/query-samples.json";

    private SampleCatalog() {}

    /**
     * Loads the bundled samples.
     *
     * @return the samples labelled {@code Query#1..N}
     * @throws CatalogException if the resource is missing or malformed
     */
    public static List<QuerySample> load() {
        try (InputStream in = SampleCatalog.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new CatalogException("Sample resource not found on classpath: " + RESOURCE);
            }
            List<QuerySample> samples = SemanticDocumentReader.readSamples(in);
            logger.debug("Loaded {} query samples from {}", samples.size(), RESOURCE);
            return Collections.unmodifiableList(samples);
        } catch (IOException e) {
            throw new CatalogException("Failed to close sample resource " + RESOURCE, e);
        }
    }
}
