package com.williamcallahan.cleanhtml.service.html;

/**
 * Signals that a protected preformatted block could not be put back into reconstructed text.
 */
public class PlaceholderRestorationException extends IllegalStateException {

    /**
     * Creates the exception with a description of the missing or duplicated placeholder.
     *
     * @param message failure summary
     */
    public PlaceholderRestorationException(String message) {
        super(message);
    }
}
