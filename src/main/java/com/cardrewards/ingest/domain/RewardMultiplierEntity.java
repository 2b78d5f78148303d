package com.cardrewards.ingest.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Reward multiplier for a (category, card) pair.
 * Maintained outside this service; the ingest pipeline only reads it.
 */
@Entity
@Table(name = "multipliers",
        uniqueConstraints = @UniqueConstraint(name = "uq_category_card", columnNames = {"category", "card"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RewardMultiplierEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String category;

    @Column(nullable = false)
    private String card;

    @Column(nullable = false)
    private int multiplier;
}
