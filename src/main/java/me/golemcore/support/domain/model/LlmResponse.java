package me.golemcore.support.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Text completion returned by a language model.
 */
@Data
@Builder
public class LlmResponse {

    private String content;
    private String model;
    private String finishReason;
}
