package com.signalloop.repository;

import com.signalloop.model.PublishedPost;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface PublishedPostRepository extends JpaRepository<PublishedPost, String> {
    List<PublishedPost> findByPublishedAtAfterOrderByPublishedAtDesc(OffsetDateTime since, Pageable pageable);
    List<PublishedPost> findByPublishedAtBetweenOrderByPublishedAtAsc(
            OffsetDateTime from, OffsetDateTime to, Pageable pageable);
}
