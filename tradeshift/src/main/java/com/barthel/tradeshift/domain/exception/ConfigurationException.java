package com.barthel.tradeshift.domain.exception;

/**
 * Raised when the analysis is configured in a way that cannot produce a
 * meaningful result (unknown normalisation, too few random attack trials,
 * ambiguous anchor countries).
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
