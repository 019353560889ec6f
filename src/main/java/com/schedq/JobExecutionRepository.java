package com.schedq;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecution, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM JobExecution e WHERE e.id = :id")
    Optional<JobExecution> findByIdForUpdate(@Param("id") UUID id);

    List<JobExecution> findByJobIdOrderByStartedAtDesc(UUID jobId);

    List<JobExecution> findByJobIdOrderByStartedAtDesc(UUID jobId, Pageable pageable);

    List<JobExecution> findByJobIdAndStatus(UUID jobId, ExecutionStatus status);

    @Modifying
    @Query("DELETE FROM JobExecution e WHERE e.jobId = :jobId")
    int deleteByJobId(@Param("jobId") UUID jobId);
}
