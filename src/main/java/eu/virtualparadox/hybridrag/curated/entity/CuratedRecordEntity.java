package eu.virtualparadox.hybridrag.curated.entity;

import eu.virtualparadox.hybridrag.curated.model.CuratedRecord;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "curated_records")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CuratedRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 2048, nullable = false)
    private String question;

    @Column(length = 16384, nullable = false)
    private String answer;

    @Column(name = "approved_at", nullable = false)
    private Instant approvedAt;

    @PrePersist
    void prePersist() {
        if (approvedAt == null) {
            approvedAt = Instant.now();
        }
    }

    public CuratedRecord toRecord() {
        return new CuratedRecord(question, answer, approvedAt);
    }
}
