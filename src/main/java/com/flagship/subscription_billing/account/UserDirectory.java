package com.flagship.subscription_billing.account;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Read-only view of user accounts, used to validate new subscriptions.
 */
@Service
public class UserDirectory {

    private final JdbcTemplate jdbcTemplate;

    public UserDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @throws IllegalArgumentException if the user does not exist or is deactivated
     */
    public void requireActiveUser(UUID userId) {
        List<Boolean> active = jdbcTemplate.query(
            "SELECT is_active FROM users WHERE id = ?",
            (rs, rowNum) -> rs.getBoolean("is_active"),
            userId
        );
        if (active.isEmpty()) {
            throw new IllegalArgumentException("User not found: " + userId);
        }
        if (!active.get(0)) {
            throw new IllegalArgumentException("User is not active: " + userId);
        }
    }
}
