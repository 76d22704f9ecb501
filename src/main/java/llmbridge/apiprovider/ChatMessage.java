package llmbridge.apiprovider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One turn of a canonical conversation. Immutable; adapters only read it.
 */
public class ChatMessage {

    public enum Role {
        UNSPECIFIED,  // system instructions
        USER,
        AGENT
    }

    private final Role role;
    private final List<MessagePart> parts;
    private final ThinkingBlock thinking;

    public ChatMessage(Role role, List<MessagePart> parts) {
        this(role, parts, null);
    }

    /**
     * @param thinking reasoning trace the agent produced on this turn, replayed on later turns
     */
    public ChatMessage(Role role, List<MessagePart> parts, ThinkingBlock thinking) {
        if (role == null) {
            throw new IllegalArgumentException("Message role cannot be null");
        }
        this.role = role;
        this.parts = parts != null ? Collections.unmodifiableList(new ArrayList<>(parts)) : Collections.emptyList();
        this.thinking = thinking;
    }

    public static ChatMessage system(String text) {
        return new ChatMessage(Role.UNSPECIFIED, List.of(MessagePart.text(text)));
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(Role.USER, List.of(MessagePart.text(text)));
    }

    public static ChatMessage user(MessagePart... parts) {
        return new ChatMessage(Role.USER, Arrays.asList(parts));
    }

    public static ChatMessage agent(String text) {
        return new ChatMessage(Role.AGENT, List.of(MessagePart.text(text)));
    }

    public static ChatMessage agent(ThinkingBlock thinking, MessagePart... parts) {
        return new ChatMessage(Role.AGENT, Arrays.asList(parts), thinking);
    }

    public Role getRole() {
        return role;
    }

    public List<MessagePart> getParts() {
        return parts;
    }

    public ThinkingBlock getThinking() {
        return thinking;
    }

    /**
     * Concatenation of all text parts, in order.
     */
    public String getText() {
        StringBuilder text = new StringBuilder();
        for (MessagePart part : parts) {
            if (part instanceof MessagePart.TextPart) {
                text.append(((MessagePart.TextPart) part).getText());
            }
        }
        return text.toString();
    }

    public List<ToolCall> getToolCalls() {
        List<ToolCall> calls = new ArrayList<>();
        for (MessagePart part : parts) {
            if (part instanceof MessagePart.ToolCallPart) {
                calls.add(((MessagePart.ToolCallPart) part).getToolCall());
            }
        }
        return calls;
    }

    public boolean hasToolCalls() {
        for (MessagePart part : parts) {
            if (part.getKind() == MessagePart.Kind.TOOL_CALL) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ChatMessage{role=" + role + ", parts=" + parts.size() + (thinking != null ? ", thinking" : "") + "}";
    }
}
