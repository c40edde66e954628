package com.clauselens.domain.comparison.repository;

import com.clauselens.domain.comparison.model.Comparison;
import com.clauselens.domain.comparison.model.ComparisonStatus;
import org.springframework.data.domain.Pageable;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ComparisonRepository extends JpaRepository<Comparison, String> {

    List<Comparison> findByOrgIdOrderByCreatedAtDesc(String orgId);

    List<ComparisonStatusView> findStatusViewsByOrgIdOrderByCreatedAtDesc(String orgId);

    Optional<ComparisonStatusView> findStatusViewById(String id);

    List<ComparisonStatusView> findStatusViewsByOrgIdAndIdIn(String orgId, Collection<String> ids);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Comparison c where c.id = :id")
    Optional<Comparison> findByIdForUpdate(@Param("id") String id);

    boolean existsBySourceContractIdOrTargetContractId(String sourceContractId, String targetContractId);

    /**
     * Ids of processing comparisons nobody currently holds a live lease on, oldest first.
     */
    @Query("select c.id from Comparison c where c.status = :status "
            + "and (c.leaseOwner is null or c.leaseExpiresAt < :now) order by c.createdAt")
    List<String> findClaimableIds(@Param("status") ComparisonStatus status,
                                  @Param("now") LocalDateTime now,
                                  Pageable pageable);

    /**
     * Atomically takes the lease of a processing comparison. Returns 1 when claimed.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update Comparison c set c.leaseOwner = :owner, c.leaseExpiresAt = :expiresAt, "
            + "c.attempts = c.attempts + 1 where c.id = :id and c.status = :status "
            + "and (c.leaseOwner is null or c.leaseExpiresAt < :now)")
    int claim(@Param("id") String id,
              @Param("owner") String owner,
              @Param("status") ComparisonStatus status,
              @Param("now") LocalDateTime now,
              @Param("expiresAt") LocalDateTime expiresAt);

    /**
     * Extends a lease still held by {@code owner}. Returns 0 when the lease was lost.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update Comparison c set c.leaseExpiresAt = :expiresAt "
            + "where c.id = :id and c.leaseOwner = :owner and c.status = :status")
    int renewLease(@Param("id") String id,
                   @Param("owner") String owner,
                   @Param("status") ComparisonStatus status,
                   @Param("expiresAt") LocalDateTime expiresAt);

    /**
     * Gives back a lease that never started a run, without counting the attempt.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update Comparison c set c.leaseOwner = null, c.leaseExpiresAt = null, c.attempts = c.attempts - 1 "
            + "where c.id = :id and c.leaseOwner = :owner")
    int releaseLease(@Param("id") String id, @Param("owner") String owner);
}
