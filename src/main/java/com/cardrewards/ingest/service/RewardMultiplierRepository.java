package com.cardrewards.ingest.service;

import com.cardrewards.ingest.domain.RewardMultiplierEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Spring Data JPA repository for the reward multiplier table.
 * Provides lookup by the exact (category, card) pair.
 */
@Repository
public interface RewardMultiplierRepository extends JpaRepository<RewardMultiplierEntity, Long> {

    Optional<RewardMultiplierEntity> findByCategoryAndCard(String category, String card);
}
