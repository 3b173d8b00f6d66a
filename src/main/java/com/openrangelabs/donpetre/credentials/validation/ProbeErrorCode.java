package com.openrangelabs.donpetre.credentials.validation;

/**
 * Why a live validation did not reach a verdict from the provider.
 */
public enum ProbeErrorCode {
    /** Provider has no live endpoint. */
    UNSUPPORTED,
    RATE_LIMITED,
    /** Provider answered with a non-2xx status. */
    HTTP_ERROR,
    TIMEOUT,
    NETWORK,
    ABORTED
}
