package llmbridge.apiprovider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a non-streaming call.
 */
public final class CompletionResult {
    private final String text;
    private final List<ToolCall> toolCalls;
    private final int tokensUsed;
    private final ThinkingBlock thinking;
    private final String finishReason;

    public CompletionResult(String text, List<ToolCall> toolCalls, int tokensUsed,
                            ThinkingBlock thinking, String finishReason) {
        this.text = text != null ? text : "";
        this.toolCalls = toolCalls != null ? Collections.unmodifiableList(new ArrayList<>(toolCalls)) : Collections.emptyList();
        this.tokensUsed = tokensUsed;
        this.thinking = thinking;
        this.finishReason = finishReason;
    }

    public String getText() { return text; }
    public List<ToolCall> getToolCalls() { return toolCalls; }
    public boolean hasToolCalls() { return !toolCalls.isEmpty(); }
    public int getTokensUsed() { return tokensUsed; }

    /** Null when the model produced no reasoning trace. */
    public ThinkingBlock getThinking() { return thinking; }

    /** Vendor stop reason, if the vendor reported one. */
    public String getFinishReason() { return finishReason; }

    @Override
    public String toString() {
        return "CompletionResult{text=" + text.length() + " chars, toolCalls=" + toolCalls.size()
            + ", tokensUsed=" + tokensUsed + ", thinking=" + (thinking != null) + ", finishReason=" + finishReason + "}";
    }
}
