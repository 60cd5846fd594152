package com.document.intelligence.repository;

import com.document.intelligence.entity.DocumentTransition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DocumentTransitionRepository extends JpaRepository<DocumentTransition, Long> {

    List<DocumentTransition> findByDocumentIdOrderByIdAsc(String documentId);
}
