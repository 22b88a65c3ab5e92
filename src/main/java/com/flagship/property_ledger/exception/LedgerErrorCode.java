package com.flagship.property_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of the ledger core.
 *
 * Every code is a reported business failure: the shared state is left exactly as it
 * was before the rejected operation started.
 */
public enum LedgerErrorCode {
    /**
     * Referenced property, listing or proposal does not exist.
     */
    NOT_FOUND(HttpStatus.NOT_FOUND),

    /**
     * Caller's role does not meet the operation's required role.
     */
    UNAUTHORIZED(HttpStatus.FORBIDDEN),

    /**
     * Requested quantity exceeds the holder's balance.
     */
    INSUFFICIENT_BALANCE(HttpStatus.CONFLICT),

    /**
     * Requested quantity exceeds the property's unissued shares.
     */
    INSUFFICIENT_SUPPLY(HttpStatus.CONFLICT),

    /**
     * One-time admin bootstrap was already performed.
     */
    ALREADY_BOOTSTRAPPED(HttpStatus.CONFLICT),

    /**
     * Proposal not found, not open, already voted on by this identity, or voter holds no shares.
     */
    NOT_VOTABLE(HttpStatus.CONFLICT),

    /**
     * Proposal not found or no longer open.
     */
    NOT_EXECUTABLE(HttpStatus.CONFLICT);

    private final HttpStatus httpStatus;

    LedgerErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
