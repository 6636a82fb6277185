package eu.virtualparadox.hybridrag.rag.index.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Atomic indexed item: a document chunk or a curated question/answer record.
 * <p>{@code text} is exactly what gets embedded and what keyword matching runs against.
 * For curated records it is the canonical {@link #CURATED_TEXT_FORMAT} rendering of question and answer.</p>
 *
 * @param id         stable identifier assigned by the index at insertion, {@link #UNASSIGNED} before that
 * @param text       embedded / matched text (non-blank)
 * @param sourceId   originating document, or {@link #CURATED_SOURCE_ID}
 * @param pageNumber 1-based page of a document chunk, {@code null} for curated records
 * @param kind       unit kind
 * @param question   curated question, {@code null} for document chunks
 * @param answer     curated answer, {@code null} for document chunks
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetrievalUnit(long id,
                            String text,
                            String sourceId,
                            Integer pageNumber,
                            UnitKind kind,
                            String question,
                            String answer) {

    public static final long UNASSIGNED = -1L;
    public static final String CURATED_SOURCE_ID = "FAQ";
    public static final String CURATED_TEXT_FORMAT = "質問: %s\n回答: %s";

    public RetrievalUnit {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(kind, "kind");
        if (kind == UnitKind.CURATED_RECORD && (question == null || answer == null)) {
            throw new IllegalArgumentException("curated record requires question and answer");
        }
    }

    public static RetrievalUnit documentChunk(final String text, final String sourceId, final int pageNumber) {
        return new RetrievalUnit(UNASSIGNED, text, sourceId, pageNumber, UnitKind.DOCUMENT_CHUNK, null, null);
    }

    public static RetrievalUnit curatedRecord(final String question, final String answer) {
        return new RetrievalUnit(UNASSIGNED, canonicalText(question, answer), CURATED_SOURCE_ID, null,
                UnitKind.CURATED_RECORD, question, answer);
    }

    public static String canonicalText(final String question, final String answer) {
        return String.format(CURATED_TEXT_FORMAT, question, answer);
    }

    public RetrievalUnit withId(final long newId) {
        return new RetrievalUnit(newId, text, sourceId, pageNumber, kind, question, answer);
    }

    @JsonIgnore
    public boolean isCurated() {
        return kind == UnitKind.CURATED_RECORD;
    }
}
