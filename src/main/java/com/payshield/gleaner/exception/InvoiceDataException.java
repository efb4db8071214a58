package com.payshield.gleaner.exception;

/**
 * Thrown when invoice or line item input cannot be read or a required value is missing or malformed.
 * Ingestion failures abort the whole run.
 */
public class InvoiceDataException extends RuntimeException {

    public InvoiceDataException(String message) {
        super(message);
    }

    public InvoiceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
