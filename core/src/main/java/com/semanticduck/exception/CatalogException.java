package com.semanticduck.exception;

/**
 * Thrown when a semantic document cannot be read or a request names
 * something the catalog does not define.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
