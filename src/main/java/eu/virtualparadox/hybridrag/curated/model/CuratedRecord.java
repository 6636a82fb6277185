package eu.virtualparadox.hybridrag.curated.model;

import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;

import java.time.Instant;

/**
 * Reviewer-approved question/answer pair.
 *
 * @param question   approved question
 * @param answer     approved answer
 * @param approvedAt approval time; among records with the same question the latest one wins
 */
public record CuratedRecord(String question, String answer, Instant approvedAt) {

    public CuratedRecord {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }
        if (answer == null || answer.isBlank()) {
            throw new IllegalArgumentException("answer must not be blank");
        }
    }

    public RetrievalUnit toUnit() {
        return RetrievalUnit.curatedRecord(question, answer);
    }
}
