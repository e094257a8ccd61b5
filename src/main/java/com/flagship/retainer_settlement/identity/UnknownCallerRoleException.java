package com.flagship.retainer_settlement.identity;

/**
 * Identity headers are present but cannot be resolved to a caller.
 */
public class UnknownCallerRoleException extends RuntimeException {

    public UnknownCallerRoleException(String message) {
        super(message);
    }
}
