package com.flagship.retainer_settlement.identity;

import lombok.Value;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * The already-authenticated caller, as forwarded by the gateway.
 *
 * This service never sees credentials. It trusts {@code X-User-Id} and {@code X-User-Role}
 * and only narrows what each role may do.
 */
@Value
public class CallerIdentity {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    /**
     * Roles allowed to move deals and author invoices.
     */
    public static final Set<CallerRole> BACK_OFFICE = EnumSet.of(
            CallerRole.SUPER_ADMIN, CallerRole.ADMIN, CallerRole.ACCOUNTS);

    UUID userId;
    CallerRole role;

    public static CallerIdentity of(UUID userId, String roleHeader) {
        if (userId == null) {
            throw new UnknownCallerRoleException("Caller id is required");
        }
        CallerRole role = CallerRole.fromValue(roleHeader)
                .orElseThrow(() -> new UnknownCallerRoleException("Unknown caller role: " + roleHeader));
        return new CallerIdentity(userId, role);
    }

    public boolean isLawyer() {
        return role == CallerRole.LAWYER;
    }

    public boolean hasAnyRole(Set<CallerRole> roles) {
        return roles.contains(role);
    }

    /**
     * @throws CallerNotAuthorizedException if the caller's role is not in {@code roles}
     */
    public void requireAnyRole(Set<CallerRole> roles, String action) {
        if (!hasAnyRole(roles)) {
            throw new CallerNotAuthorizedException(
                String.format("Role %s may not %s", role.getValue(), action));
        }
    }
}
