package com.document.intelligence.repository;

import com.document.intelligence.entity.VariantProposalRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface VariantProposalRepository extends JpaRepository<VariantProposalRecord, Long> {

    List<VariantProposalRecord> findByApplicationIdOrderByCreatedAtDesc(String applicationId);

    Optional<VariantProposalRecord> findFirstByDocumentIdAndBaseTemplateIdOrderByCreatedAtDesc(String documentId,
                                                                                                String baseTemplateId);
}
