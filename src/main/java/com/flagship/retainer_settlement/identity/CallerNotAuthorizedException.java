package com.flagship.retainer_settlement.identity;

/**
 * The caller is known but its role does not permit the requested operation.
 */
public class CallerNotAuthorizedException extends RuntimeException {

    public CallerNotAuthorizedException(String message) {
        super(message);
    }
}
