package com.flamingo.ai.slunk.domain.repository;

import com.flamingo.ai.slunk.domain.entity.DeduplicationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for DeduplicationRecord entities. */
@Repository
public interface DeduplicationRecordRepository extends JpaRepository<DeduplicationRecord, String> {}
