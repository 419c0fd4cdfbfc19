package com.signalloop.repository;

import com.signalloop.model.DecisionOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface DecisionOutcomeRepository extends JpaRepository<DecisionOutcome, Long> {
    Optional<DecisionOutcome> findByPostId(String postId);
    List<DecisionOutcome> findByDecidedAtGreaterThanEqualAndRewardIsNotNull(OffsetDateTime since);
}
