package com.sashkomusic.coverartagent.domain.exception;

/**
 * MusicBrainz answered 200 but the body did not match the expected shape.
 * Signals a service contract change rather than a missing record.
 */
public class MalformedLookupResponseException extends RuntimeException {

    public MalformedLookupResponseException(String message) {
        super(message);
    }

    public MalformedLookupResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
