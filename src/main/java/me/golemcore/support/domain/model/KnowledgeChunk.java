package me.golemcore.support.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Knowledge base passage. The embedding is filled in when the passage is
 * indexed, not when it is loaded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeChunk {

    private String id;
    private String title;
    private String content;
    private String category;

    @Builder.Default
    private boolean active = true;

    private float[] embedding;
}
