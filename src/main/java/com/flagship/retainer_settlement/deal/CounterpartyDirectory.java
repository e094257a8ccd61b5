package com.flagship.retainer_settlement.deal;

import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only look-ups of invoice counterparties: attorney profiles and lead-vendor centers.
 *
 * Both tables belong to other parts of the platform, so they are read with plain SQL
 * instead of being mapped as entities here.
 */
@Service
public class CounterpartyDirectory {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public CounterpartyDirectory(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Full names of the given attorneys. Attorneys without a profile are absent from the map.
     */
    public Map<UUID, String> attorneyNames(Collection<UUID> attorneyIds) {
        Map<UUID, String> names = new HashMap<>();
        if (attorneyIds.isEmpty()) {
            return names;
        }
        jdbcTemplate.query(
            "SELECT user_id, full_name FROM attorney_profiles WHERE user_id IN (:ids)",
            new MapSqlParameterSource("ids", attorneyIds),
            rs -> {
                String fullName = rs.getString("full_name");
                if (fullName != null && !fullName.isBlank()) {
                    names.put(UUID.fromString(rs.getString("user_id")), fullName.trim());
                }
            }
        );
        return names;
    }

    /**
     * The lead-vendor name deals carry in {@code daily_deal_flow.lead_vendor} for a center.
     */
    public Optional<String> leadVendorName(UUID centerId) {
        try {
            String name = jdbcTemplate.queryForObject(
                "SELECT lead_vendor FROM centers WHERE id = :id",
                new MapSqlParameterSource("id", centerId),
                String.class
            );
            return Optional.ofNullable(name).filter(n -> !n.isBlank());
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }
}
