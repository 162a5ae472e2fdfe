package com.intellilend.liquidation.model.documents;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Append-only audit row; written once, never updated.
 */
@Document("audit_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEventDocument {

    private @Id String id;

    @Indexed
    private String tag;            // e.g. "LIQUIDATION_COMPLETED"

    @Indexed
    private String borrower;

    private String payload;        // serialized AuditEvent JSON

    @Field("created_at")
    private Instant createdAt;
}
