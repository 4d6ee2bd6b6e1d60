package com.flagship.subscription_billing.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL ledger on plain JDBC.
 *
 * The schema backs the invariants the code relies on:
 * <ul>
 *   <li>a trigger rejects UPDATE and DELETE on {@code ledger_entries}</li>
 *   <li>a partial unique index allows one determinate entry per idempotency key</li>
 *   <li>a partial unique index allows one SUCCESS per subscription and billing date</li>
 * </ul>
 * Every append commits in its own transaction, so a recorded charge outcome
 * survives a later failure of the subscription update.
 */
@Repository
@Slf4j
public class JdbcLedger implements Ledger {

    private static final String ENTRY_COLUMNS =
        "id, sequence_number, subscription_id, amount, outcome, billing_date, " +
        "idempotency_key, gateway_transaction_id, failure_reason, processed_at";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JdbcLedger(JdbcTemplate jdbcTemplate, NamedParameterJdbcTemplate namedJdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = namedJdbcTemplate;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID append(LedgerEntry entry) {
        try {
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, subscription_id, amount, outcome, billing_date, " +
                "idempotency_key, gateway_transaction_id, failure_reason, processed_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                entry.getId(),
                entry.getSubscriptionId(),
                entry.getAmount(),
                entry.getOutcome().name(),
                entry.getBillingDate(),
                entry.getIdempotencyKey(),
                entry.getGatewayTransactionId(),
                entry.getFailureReason(),
                Timestamp.from(entry.getProcessedAt())
            );
        } catch (DuplicateKeyException e) {
            log.warn("Duplicate ledger entry rejected: idempotencyKey={}, outcome={}",
                    entry.getIdempotencyKey(), entry.getOutcome());
            throw new DuplicateChargeAttemptException(entry.getIdempotencyKey(), e);
        } catch (DataAccessException e) {
            log.error("Ledger append failed: idempotencyKey={}, outcome={}, error={}",
                    entry.getIdempotencyKey(), entry.getOutcome(), e.getMessage());
            throw new LedgerWriteException("Failed to append ledger entry " + entry.getIdempotencyKey(), e);
        }

        log.debug("Ledger entry appended: entryId={}, outcome={}, amount={}",
                entry.getId(), entry.getOutcome(), entry.getAmount());
        return entry.getId();
    }

    @Override
    public LedgerHistory history(UUID subscriptionId, int limit) {
        return new LedgerHistory((beforeSequence, pageSize) -> loadPage(subscriptionId, beforeSequence, pageSize), limit);
    }

    private List<LedgerEntry> loadPage(UUID subscriptionId, Long beforeSequence, int pageSize) {
        if (beforeSequence == null) {
            return jdbcTemplate.query(
                "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries " +
                "WHERE subscription_id = ? ORDER BY sequence_number DESC LIMIT ?",
                ledgerEntryRowMapper(),
                subscriptionId,
                pageSize
            );
        }
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries " +
            "WHERE subscription_id = ? AND sequence_number < ? ORDER BY sequence_number DESC LIMIT ?",
            ledgerEntryRowMapper(),
            subscriptionId,
            beforeSequence,
            pageSize
        );
    }

    @Override
    public Map<UUID, List<LedgerEntry>> recentHistory(Collection<UUID> subscriptionIds, int perSubscription) {
        Map<UUID, List<LedgerEntry>> bySubscription = new LinkedHashMap<>();
        if (subscriptionIds.isEmpty() || perSubscription <= 0) {
            return bySubscription;
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ids", subscriptionIds)
            .addValue("perSubscription", perSubscription);

        List<LedgerEntry> rows = namedJdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM (" +
            "  SELECT le.*, ROW_NUMBER() OVER (PARTITION BY subscription_id ORDER BY sequence_number DESC) AS rn" +
            "  FROM ledger_entries le WHERE subscription_id IN (:ids)" +
            ") ranked WHERE rn <= :perSubscription " +
            "ORDER BY subscription_id, sequence_number DESC",
            params,
            ledgerEntryRowMapper()
        );

        for (LedgerEntry row : rows) {
            bySubscription.computeIfAbsent(row.getSubscriptionId(), id -> new ArrayList<>()).add(row);
        }
        return bySubscription;
    }

    @Override
    public Optional<LedgerEntry> findDeterminateByIdempotencyKey(String idempotencyKey) {
        List<LedgerEntry> entries = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries " +
            "WHERE idempotency_key = ? AND outcome <> 'PENDING'",
            ledgerEntryRowMapper(),
            idempotencyKey
        );
        return entries.stream().findFirst();
    }

    @Override
    public int countFailedAttempts(UUID subscriptionId, LocalDate billingDate) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries " +
            "WHERE subscription_id = ? AND billing_date = ? AND outcome = 'FAILED'",
            Integer.class,
            subscriptionId,
            billingDate
        );
        return count != null ? count : 0;
    }

    @Override
    public int countConsecutiveFailures(UUID subscriptionId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries " +
            "WHERE subscription_id = ? AND outcome = 'FAILED' " +
            "AND sequence_number > COALESCE((" +
            "  SELECT MAX(sequence_number) FROM ledger_entries " +
            "  WHERE subscription_id = ? AND outcome = 'SUCCESS'), 0)",
            Integer.class,
            subscriptionId,
            subscriptionId
        );
        return count != null ? count : 0;
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            rs.getLong("sequence_number"),
            UUID.fromString(rs.getString("subscription_id")),
            rs.getBigDecimal("amount"),
            ChargeOutcome.valueOf(rs.getString("outcome")),
            rs.getObject("billing_date", LocalDate.class),
            rs.getString("idempotency_key"),
            rs.getString("gateway_transaction_id"),
            rs.getString("failure_reason"),
            rs.getTimestamp("processed_at").toInstant()
        );
    }
}
