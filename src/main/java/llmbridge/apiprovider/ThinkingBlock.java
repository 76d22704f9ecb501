package llmbridge.apiprovider;

import java.util.Objects;

/**
 * A reasoning trace plus the opaque vendor signature that authenticates it on replay.
 */
public final class ThinkingBlock {
    private final String content;
    private final String signature;

    public ThinkingBlock(String content, String signature) {
        this.content = content != null ? content : "";
        this.signature = signature != null ? signature : "";
    }

    public String getContent() { return content; }
    public String getSignature() { return signature; }

    /**
     * Only blocks carrying both content and a signature can be sent back to the vendor.
     */
    public boolean isReplayable() {
        return !content.isEmpty() && !signature.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ThinkingBlock)) return false;
        ThinkingBlock other = (ThinkingBlock) o;
        return content.equals(other.content) && signature.equals(other.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, signature);
    }

    @Override
    public String toString() {
        return "ThinkingBlock{content=" + content.length() + " chars, signed=" + !signature.isEmpty() + "}";
    }
}
