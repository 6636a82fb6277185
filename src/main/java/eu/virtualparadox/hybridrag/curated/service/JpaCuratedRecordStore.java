package eu.virtualparadox.hybridrag.curated.service;

import eu.virtualparadox.hybridrag.curated.entity.CuratedRecordEntity;
import eu.virtualparadox.hybridrag.curated.model.CuratedRecord;
import eu.virtualparadox.hybridrag.curated.repo.CuratedRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CuratedRecordStore} on the relational catalog (H2 through Spring Data JPA).
 * <p>A question approved more than once keeps the most recent answer, at the position where
 * the question first appeared.</p>
 */
@Service
@RequiredArgsConstructor
public class JpaCuratedRecordStore implements CuratedRecordStore {

    private final CuratedRecordRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<CuratedRecord> listApproved() {
        final Map<String, CuratedRecord> latest = new LinkedHashMap<>();
        for (final CuratedRecordEntity entity : repository.findAllByOrderByIdAsc()) {
            final CuratedRecord record = entity.toRecord();
            final String key = record.question().trim();
            final CuratedRecord existing = latest.get(key);
            if (existing == null || !record.approvedAt().isBefore(existing.approvedAt())) {
                latest.put(key, record);
            }
        }
        return new ArrayList<>(latest.values());
    }

    @Override
    @Transactional
    public CuratedRecord save(final String question, final String answer) {
        final CuratedRecord approved = new CuratedRecord(question, answer, Instant.now());
        final CuratedRecordEntity entity = CuratedRecordEntity.builder()
                .question(approved.question())
                .answer(approved.answer())
                .approvedAt(approved.approvedAt())
                .build();
        return repository.save(entity).toRecord();
    }
}
