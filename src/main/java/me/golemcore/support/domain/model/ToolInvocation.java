package me.golemcore.support.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Summary of one tool call, recorded on the assistant message that used it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolInvocation {

    private static final int MAX_PREVIEW_LENGTH = 300;

    private String name;
    private Map<String, Object> arguments;
    private boolean success;
    private ToolFailureKind failureKind;
    private String resultPreview;

    public static ToolInvocation of(String name, Map<String, Object> arguments, ToolResult result) {
        String text = result.isSuccess() ? result.getOutput() : result.getError();
        if (text != null && text.length() > MAX_PREVIEW_LENGTH) {
            text = text.substring(0, MAX_PREVIEW_LENGTH) + "...";
        }
        return ToolInvocation.builder()
                .name(name)
                .arguments(arguments)
                .success(result.isSuccess())
                .failureKind(result.getFailureKind())
                .resultPreview(text)
                .build();
    }
}
