package com.signalloop.repository;

import com.signalloop.model.ControlPlaneState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ControlPlaneStateRepository extends JpaRepository<ControlPlaneState, Long> {

    Optional<ControlPlaneState> findFirstByExpiresAtIsNullOrderByEffectiveAtDesc();

    List<ControlPlaneState> findAllByOrderByEffectiveAtDesc(Pageable pageable);

    long countByExpiresAtIsNull();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ControlPlaneState c SET c.expiresAt = :expiresAt WHERE c.expiresAt IS NULL")
    int expireActive(@Param("expiresAt") OffsetDateTime expiresAt);

    /**
     * Transaction-scoped; released on commit or rollback.
     */
    @Query(value = "SELECT pg_try_advisory_xact_lock(:lockKey)", nativeQuery = true)
    boolean tryAdvisoryTransactionLock(@Param("lockKey") long lockKey);
}
