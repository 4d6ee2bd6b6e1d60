package com.flagship.subscription_billing.subscription;

import com.flagship.subscription_billing.subscription.exception.StaleSubscriptionException;
import com.flagship.subscription_billing.subscription.exception.SubscriptionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Subscription state in PostgreSQL.
 *
 * Billing writes are single conditional UPDATE statements: the version
 * check, the cancelled check and the forward-only date check all happen in
 * the WHERE clause, so no row lock is held across a charge call.
 */
@Repository
@Slf4j
public class JdbcSubscriptionStore implements SubscriptionStore {

    private static final String COLUMNS =
        "id, user_id, plan_id, status, next_billing_date, created_at, cancelled_at, version";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final Clock clock;

    public JdbcSubscriptionStore(JdbcTemplate jdbcTemplate,
                                 NamedParameterJdbcTemplate namedJdbcTemplate,
                                 Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = namedJdbcTemplate;
        this.clock = clock;
    }

    @Override
    public List<Subscription> findDue(LocalDate asOf, int limit) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM subscriptions " +
            "WHERE status IN ('ACTIVE', 'PAST_DUE') AND next_billing_date <= ? " +
            "ORDER BY next_billing_date, id LIMIT ?",
            subscriptionRowMapper(),
            asOf,
            limit
        );
    }

    @Override
    public List<Subscription> findDueAfter(LocalDate asOf, DueCursor cursor, int limit) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM subscriptions " +
            "WHERE status IN ('ACTIVE', 'PAST_DUE') AND next_billing_date <= ? " +
            "AND (next_billing_date, id) > (?, ?) " +
            "ORDER BY next_billing_date, id LIMIT ?",
            subscriptionRowMapper(),
            asOf,
            cursor.getNextBillingDate(),
            cursor.getId(),
            limit
        );
    }

    @Override
    public Optional<Subscription> findById(UUID id) {
        List<Subscription> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM subscriptions WHERE id = ?",
            subscriptionRowMapper(),
            id
        );
        return rows.stream().findFirst();
    }

    @Override
    public List<Subscription> findByUser(UUID userId, SubscriptionStatus status, int offset, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM subscriptions WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("offset", offset)
            .addValue("limit", limit);

        if (userId != null) {
            sql.append(" AND user_id = :userId");
            params.addValue("userId", userId);
        }
        if (status != null) {
            sql.append(" AND status = :status");
            params.addValue("status", status.name());
        }
        sql.append(" ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset");

        return namedJdbcTemplate.query(sql.toString(), params, subscriptionRowMapper());
    }

    @Override
    public Subscription insert(Subscription subscription) {
        Timestamp createdAt = Timestamp.from(subscription.getCreatedAt());
        jdbcTemplate.update(
            "INSERT INTO subscriptions (id, user_id, plan_id, status, next_billing_date, " +
            "created_at, updated_at, cancelled_at, version) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            subscription.getId(),
            subscription.getUserId(),
            subscription.getPlanId(),
            subscription.getStatus().name(),
            subscription.getNextBillingDate(),
            createdAt,
            createdAt,
            subscription.getCancelledAt() != null ? Timestamp.from(subscription.getCancelledAt()) : null,
            subscription.getVersion()
        );
        return subscription;
    }

    @Override
    public Subscription updateAfterAttempt(UUID id, long expectedVersion,
                                           SubscriptionStatus newStatus, LocalDate newNextBillingDate) {
        if (newStatus == null || newNextBillingDate == null) {
            throw new IllegalArgumentException("New status and billing date are required");
        }

        Timestamp now = Timestamp.from(clock.instant());
        Timestamp cancelledAt = newStatus == SubscriptionStatus.CANCELLED ? now : null;
        List<Subscription> updated = jdbcTemplate.query(
            "UPDATE subscriptions SET status = ?, next_billing_date = ?, version = version + 1, " +
            "updated_at = ?, cancelled_at = COALESCE(cancelled_at, ?) " +
            "WHERE id = ? AND version = ? AND status <> 'CANCELLED' AND next_billing_date <= ? " +
            "RETURNING " + COLUMNS,
            subscriptionRowMapper(),
            newStatus.name(),
            newNextBillingDate,
            now,
            cancelledAt,
            id,
            expectedVersion,
            newNextBillingDate
        );

        if (updated.isEmpty()) {
            if (!exists(id)) {
                throw new SubscriptionNotFoundException(id);
            }
            log.info("Conditional update rejected: subscriptionId={}, expectedVersion={}", id, expectedVersion);
            throw new StaleSubscriptionException(id, expectedVersion);
        }
        return updated.get(0);
    }

    @Override
    public boolean cancel(UUID id, Instant cancelledAt) {
        int rows = jdbcTemplate.update(
            "UPDATE subscriptions SET status = 'CANCELLED', cancelled_at = ?, updated_at = ?, " +
            "version = version + 1 WHERE id = ? AND status <> 'CANCELLED'",
            Timestamp.from(cancelledAt),
            Timestamp.from(cancelledAt),
            id
        );
        if (rows == 0 && !exists(id)) {
            throw new SubscriptionNotFoundException(id);
        }
        return rows > 0;
    }

    private boolean exists(UUID id) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM subscriptions WHERE id = ?",
            Integer.class,
            id
        );
        return count != null && count > 0;
    }

    private RowMapper<Subscription> subscriptionRowMapper() {
        return (rs, rowNum) -> {
            Timestamp cancelledAt = rs.getTimestamp("cancelled_at");
            return new Subscription(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("user_id")),
                UUID.fromString(rs.getString("plan_id")),
                SubscriptionStatus.valueOf(rs.getString("status")),
                rs.getObject("next_billing_date", LocalDate.class),
                rs.getTimestamp("created_at").toInstant(),
                cancelledAt != null ? cancelledAt.toInstant() : null,
                rs.getLong("version")
            );
        };
    }
}
