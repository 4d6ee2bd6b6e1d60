package com.flagship.subscription_billing.billing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BillingRunRepository extends JpaRepository<BillingRunEntity, UUID> {

    Optional<BillingRunEntity> findFirstByOrderByStartedAtDesc();
}
