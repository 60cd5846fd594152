package com.document.intelligence.repository;

import com.document.intelligence.entity.DocumentRecord;
import com.document.intelligence.model.DocumentState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface DocumentRecordRepository extends JpaRepository<DocumentRecord, String> {

    List<DocumentRecord> findByStateInOrderByCreatedAtAsc(Collection<DocumentState> states);

    List<DocumentRecord> findByStateOrderByUpdatedAtDesc(DocumentState state);

    List<DocumentRecord> findByApplicationIdAndStateOrderByUpdatedAtDesc(String applicationId, DocumentState state);
}
