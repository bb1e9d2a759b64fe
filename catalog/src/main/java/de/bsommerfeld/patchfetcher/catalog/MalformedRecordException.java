package de.bsommerfeld.patchfetcher.catalog;

/**
 * A single catalog entry lacks a field required to build a record. The entry
 * is skipped; the query goes on.
 */
public class MalformedRecordException extends Exception {

    public MalformedRecordException(String message) {
        super(message);
    }
}
