package com.flagship.subscription_billing.catalog;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to {@code subscription_plans}.
 */
@Service
public class PlanCatalog {

    private final JdbcTemplate jdbcTemplate;

    public PlanCatalog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Plan> findById(UUID planId) {
        List<Plan> plans = jdbcTemplate.query(
            "SELECT id, name, price, billing_cycle, is_active FROM subscription_plans WHERE id = ?",
            planRowMapper(),
            planId
        );
        return plans.stream().findFirst();
    }

    /**
     * Loads a plan that is still on sale, for new subscriptions.
     *
     * @throws IllegalArgumentException if the plan is unknown or inactive
     */
    public Plan requireActivePlan(UUID planId) {
        Plan plan = findById(planId)
            .orElseThrow(() -> new IllegalArgumentException("Plan not found: " + planId));
        if (!plan.isActive()) {
            throw new IllegalArgumentException("Plan is not active: " + planId);
        }
        return plan;
    }

    private RowMapper<Plan> planRowMapper() {
        return (rs, rowNum) -> new Plan(
            UUID.fromString(rs.getString("id")),
            rs.getString("name"),
            rs.getBigDecimal("price"),
            BillingCycle.valueOf(rs.getString("billing_cycle")),
            rs.getBoolean("is_active")
        );
    }
}
