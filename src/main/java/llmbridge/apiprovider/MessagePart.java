package llmbridge.apiprovider;

import com.google.gson.JsonObject;

/**
 * A piece of message content. The set of variants is closed: text, file,
 * tool call and tool result.
 */
public abstract class MessagePart {

    public enum Kind {
        TEXT,
        FILE,
        TOOL_CALL,
        TOOL_RESULT
    }

    private MessagePart() {
    }

    public abstract Kind getKind();

    public static TextPart text(String text) {
        return new TextPart(text);
    }

    public static FilePart file(byte[] data, String mediaType) {
        return new FilePart(data, null, mediaType);
    }

    public static FilePart fileUri(String uri, String mediaType) {
        return new FilePart(null, uri, mediaType);
    }

    public static ToolCallPart toolCall(String id, String name, JsonObject args) {
        return new ToolCallPart(new ToolCall(id, name, args));
    }

    public static ToolResultPart toolResult(String toolCallId, String content) {
        return new ToolResultPart(toolCallId, content, false);
    }

    public static ToolResultPart toolError(String toolCallId, String message) {
        return new ToolResultPart(toolCallId, message, true);
    }

    public static final class TextPart extends MessagePart {
        private final String text;

        private TextPart(String text) {
            this.text = text != null ? text : "";
        }

        @Override
        public Kind getKind() { return Kind.TEXT; }

        public String getText() { return text; }
    }

    /**
     * Inline bytes or a URI reference. A null media type means "detect from the bytes".
     */
    public static final class FilePart extends MessagePart {
        private final byte[] data;
        private final String uri;
        private final String mediaType;

        private FilePart(byte[] data, String uri, String mediaType) {
            if ((data == null) == (uri == null)) {
                throw new IllegalArgumentException("A file part needs either bytes or a URI");
            }
            this.data = data != null ? data.clone() : null;
            this.uri = uri;
            this.mediaType = mediaType;
        }

        @Override
        public Kind getKind() { return Kind.FILE; }

        public boolean hasData() { return data != null; }
        public byte[] getData() { return data != null ? data.clone() : null; }
        public int getSize() { return data != null ? data.length : 0; }
        public String getUri() { return uri; }
        public String getMediaType() { return mediaType; }
    }

    public static final class ToolCallPart extends MessagePart {
        private final ToolCall toolCall;

        private ToolCallPart(ToolCall toolCall) {
            this.toolCall = toolCall;
        }

        @Override
        public Kind getKind() { return Kind.TOOL_CALL; }

        public ToolCall getToolCall() { return toolCall; }
    }

    public static final class ToolResultPart extends MessagePart {
        private final String toolCallId;
        private final String content;
        private final boolean error;

        private ToolResultPart(String toolCallId, String content, boolean error) {
            this.toolCallId = toolCallId;
            this.content = content != null ? content : "";
            this.error = error;
        }

        @Override
        public Kind getKind() { return Kind.TOOL_RESULT; }

        public String getToolCallId() { return toolCallId; }
        public String getContent() { return content; }
        public boolean isError() { return error; }
    }
}
