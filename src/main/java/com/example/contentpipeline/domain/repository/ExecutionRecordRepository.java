package com.example.contentpipeline.domain.repository;

import com.example.contentpipeline.domain.model.ExecutionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, Long> {
    Optional<ExecutionRecord> findByWorkflowId(String workflowId);
}
