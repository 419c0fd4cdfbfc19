package com.signalloop.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "published_posts")
public class PublishedPost {

    @Id
    @Column(name = "post_id", nullable = false, length = 64)
    private String postId;

    @Column(name = "published_at", nullable = false)
    private OffsetDateTime publishedAt;

    @Column(name = "template_id", length = 128)
    private String templateId;

    @Column(name = "prompt_version", length = 64)
    private String promptVersion;

    @Column(name = "strategy_id", length = 128)
    private String strategyId;

    @Column(name = "strategy_version", length = 64)
    private String strategyVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
