package com.flagship.retainer_settlement.identity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CallerIdentityTest {

    private final UUID userId = UUID.randomUUID();

    @Test
    @DisplayName("Roles are parsed case-insensitively")
    void parsesRole() {
        CallerIdentity caller = CallerIdentity.of(userId, "Super_Admin");

        assertEquals(CallerRole.SUPER_ADMIN, caller.getRole());
        assertTrue(caller.hasAnyRole(CallerIdentity.BACK_OFFICE));
        assertFalse(caller.isLawyer());
    }

    @Test
    @DisplayName("Unknown or missing roles are rejected")
    void rejectsUnknownRole() {
        assertThrows(UnknownCallerRoleException.class, () -> CallerIdentity.of(userId, "janitor"));
        assertThrows(UnknownCallerRoleException.class, () -> CallerIdentity.of(userId, null));
        assertThrows(UnknownCallerRoleException.class, () -> CallerIdentity.of(null, "admin"));
    }

    @Test
    @DisplayName("Lawyers and agents are not back office")
    void requireAnyRole() {
        CallerIdentity lawyer = CallerIdentity.of(userId, "lawyer");
        CallerIdentity agent = CallerIdentity.of(userId, "agent");
        CallerIdentity accounts = CallerIdentity.of(userId, "accounts");

        assertTrue(lawyer.isLawyer());
        assertThrows(CallerNotAuthorizedException.class,
                () -> lawyer.requireAnyRole(CallerIdentity.BACK_OFFICE, "pay the BPO"));
        assertThrows(CallerNotAuthorizedException.class,
                () -> agent.requireAnyRole(CallerIdentity.BACK_OFFICE, "pay the BPO"));
        assertDoesNotThrow(() -> accounts.requireAnyRole(CallerIdentity.BACK_OFFICE, "pay the BPO"));
    }
}
