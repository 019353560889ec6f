package com.schedq;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * One row of the status histogram.
     */
    interface StatusCount {
        JobStatus getStatus();

        Long getCount();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    List<Job> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<Job> findByStatusOrderByCreatedAtDesc(JobStatus status, Pageable pageable);

    List<Job> findByTypeOrderByCreatedAtDesc(JobType type, Pageable pageable);

    List<Job> findByStatusAndTypeOrderByCreatedAtDesc(JobStatus status, JobType type, Pageable pageable);

    @Query("SELECT j.status AS status, COUNT(j) AS count FROM Job j GROUP BY j.status")
    List<StatusCount> countGroupedByStatus();
}
