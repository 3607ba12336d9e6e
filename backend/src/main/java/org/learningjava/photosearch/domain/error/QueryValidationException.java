package org.learningjava.photosearch.domain.error;

/**
 * Caller error: a query with neither image nor text, a missing directory, a bad pool size.
 */
public class QueryValidationException extends PhotoSearchException {

    public QueryValidationException(String message) {
        super(message);
    }
}
