package com.devicepush.orchestrator.domain.repository;

import com.devicepush.orchestrator.domain.model.Job;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    Optional<Job> findByJobId(String jobId);

    List<Job> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
