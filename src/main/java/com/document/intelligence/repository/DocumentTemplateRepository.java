package com.document.intelligence.repository;

import com.document.intelligence.entity.DocumentTemplate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DocumentTemplateRepository extends JpaRepository<DocumentTemplate, Long> {

    List<DocumentTemplate> findByApplicationIdOrderByIdAsc(String applicationId);

    Optional<DocumentTemplate> findByApplicationIdAndTemplateId(String applicationId, String templateId);
}
