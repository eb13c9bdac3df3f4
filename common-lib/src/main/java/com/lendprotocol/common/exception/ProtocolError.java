package com.lendprotocol.common.exception;

/**
 * Typed failure codes returned by every protocol entry point.
 */
public enum ProtocolError {
    /** Caller failed the admin check. */
    UNAUTHORIZED,
    /** A numeric argument is out of its allowed range. */
    INVALID_AMOUNT,
    /** Referenced proposal or asset does not exist. */
    NOT_FOUND,
    /** A price-source call errored, timed out or could not be resolved. */
    EXTERNAL_CALL_FAILED,
    /** A guarded section was entered again before it exited. */
    REENTRANT_CALL
}
