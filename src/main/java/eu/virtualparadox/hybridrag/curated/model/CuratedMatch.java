package eu.virtualparadox.hybridrag.curated.model;

/**
 * Curated record whose question is close enough to the user query to answer it directly.
 *
 * @param record     the matched record
 * @param similarity cosine similarity between the query and the record's question
 */
public record CuratedMatch(CuratedRecord record, double similarity) {
}
