package com.wine.resolution.ingest;

import java.io.InputStream;
import java.io.Reader;

/**
 * Reads reference-dataset rows from a specific format and feeds them to a
 * {@link CatalogImportService}.
 */
public interface BulkImporter {

    /**
     * Imports catalog rows from a UTF-8 input stream.
     *
     * @throws CatalogImportException if the source cannot be read or parsed
     */
    ImportResult importCatalog(InputStream input, ProgressCallback callback);

    /**
     * Imports catalog rows from a reader.
     *
     * @throws CatalogImportException if the source cannot be read or parsed
     */
    ImportResult importCatalog(Reader reader, ProgressCallback callback);

    /**
     * Returns the format supported by this importer, e.g. "csv" or "json".
     */
    String getFormat();
}
