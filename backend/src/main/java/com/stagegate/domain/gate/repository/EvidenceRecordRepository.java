package com.stagegate.domain.gate.repository;

import com.stagegate.domain.gate.model.EvidenceRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EvidenceRecordRepository extends JpaRepository<EvidenceRecord, Long> {

    List<EvidenceRecord> findByProjectIdOrderByRecordedAtAscIdAsc(String projectId);
}
