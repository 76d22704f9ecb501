package llmbridge.apiprovider;

import llmbridge.apiprovider.exceptions.APIProviderException;

/**
 * Canonical streaming event. DONE and ERROR are terminal; a stream carries exactly one of them, last.
 */
public final class StreamEvent {

    public enum Type {
        TEXT,
        THINKING,
        THINKING_COMPLETE,
        TOOL_CALL,
        DONE,
        ERROR;

        public boolean isTerminal() {
            return this == DONE || this == ERROR;
        }
    }

    private final Type type;
    private final String text;
    private final ThinkingBlock thinking;
    private final ToolCall toolCall;
    private final int tokensUsed;
    private final APIProviderException error;

    private StreamEvent(Type type, String text, ThinkingBlock thinking, ToolCall toolCall,
                        int tokensUsed, APIProviderException error) {
        this.type = type;
        this.text = text;
        this.thinking = thinking;
        this.toolCall = toolCall;
        this.tokensUsed = tokensUsed;
        this.error = error;
    }

    public static StreamEvent text(String text) {
        return new StreamEvent(Type.TEXT, text, null, null, 0, null);
    }

    public static StreamEvent thinking(String text) {
        return new StreamEvent(Type.THINKING, text, null, null, 0, null);
    }

    public static StreamEvent thinkingComplete(String content, String signature) {
        return new StreamEvent(Type.THINKING_COMPLETE, null, new ThinkingBlock(content, signature), null, 0, null);
    }

    public static StreamEvent toolCall(ToolCall toolCall) {
        return new StreamEvent(Type.TOOL_CALL, null, null, toolCall, 0, null);
    }

    public static StreamEvent done(int tokensUsed) {
        return new StreamEvent(Type.DONE, null, null, null, tokensUsed, null);
    }

    public static StreamEvent error(APIProviderException error) {
        return new StreamEvent(Type.ERROR, null, null, null, 0, error);
    }

    public Type getType() { return type; }
    public boolean isTerminal() { return type.isTerminal(); }

    /** Text for TEXT and THINKING events. */
    public String getText() { return text; }

    /** Completed block for THINKING_COMPLETE events. */
    public ThinkingBlock getThinking() { return thinking; }

    public ToolCall getToolCall() { return toolCall; }
    public int getTokensUsed() { return tokensUsed; }
    public APIProviderException getError() { return error; }

    @Override
    public String toString() {
        switch (type) {
            case TEXT:
            case THINKING:
                return type + "(" + text + ")";
            case THINKING_COMPLETE:
                return type + "(" + thinking + ")";
            case TOOL_CALL:
                return type + "(" + toolCall + ")";
            case DONE:
                return type + "(" + tokensUsed + ")";
            default:
                return type + "(" + (error != null ? error.getMessage() : "") + ")";
        }
    }
}
