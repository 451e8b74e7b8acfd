package com.williamcallahan.cleanhtml.domain.cleaning;

/**
 * Signals an option map that names an unknown option or carries no value for one.
 */
public class InvalidCleaningOptionException extends IllegalArgumentException {

    private final String optionKey;

    /**
     * Creates an exception for the offending option key.
     *
     * @param optionKey key that was rejected
     * @param message failure summary
     */
    public InvalidCleaningOptionException(String optionKey, String message) {
        super(message);
        this.optionKey = optionKey;
    }

    /**
     * Returns the rejected key.
     *
     * @return option key as supplied by the caller
     */
    public String getOptionKey() {
        return optionKey;
    }
}
