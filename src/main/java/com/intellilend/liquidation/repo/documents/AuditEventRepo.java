package com.intellilend.liquidation.repo.documents;

import com.intellilend.liquidation.model.documents.AuditEventDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditEventRepo extends MongoRepository<AuditEventDocument, String> {

    List<AuditEventDocument> findByBorrowerOrderByCreatedAtDesc(String borrower);

    List<AuditEventDocument> findByTagOrderByCreatedAtDesc(String tag);
}
