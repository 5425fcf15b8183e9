package org.knowhub.repository;

import org.knowhub.entity.DocumentStatus;
import org.knowhub.entity.KnowledgeDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface KnowledgeDocumentRepository extends JpaRepository<KnowledgeDocument, String> {

    List<KnowledgeDocument> findByActiveVersionIsNotNull();

    List<KnowledgeDocument> findByStatus(DocumentStatus status);
}
