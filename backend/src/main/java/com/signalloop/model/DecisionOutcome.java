package com.signalloop.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Reward-bearing decision: which template, prompt version and strategy produced
 * a post, and the reward its metrics earned.
 */
@Getter
@Setter
@Entity
@Table(name = "decision_outcomes")
public class DecisionOutcome {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "post_id", nullable = false, unique = true, length = 64)
    private String postId;

    @Column(name = "strategy_id", length = 128)
    private String strategyId;

    @Column(name = "strategy_version", length = 64)
    private String strategyVersion;

    @Column(name = "template_id", length = 128)
    private String templateId;

    @Column(name = "prompt_version", length = 64)
    private String promptVersion;

    private Double reward;

    @Column(name = "decided_at", nullable = false)
    private OffsetDateTime decidedAt;

    @Column(name = "rewarded_at")
    private OffsetDateTime rewardedAt;
}
