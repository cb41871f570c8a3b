package me.golemcore.support.domain.model;

/**
 * A knowledge passage with its cosine similarity to the query.
 */
public record KnowledgeMatch(KnowledgeChunk chunk, double score) {
}
