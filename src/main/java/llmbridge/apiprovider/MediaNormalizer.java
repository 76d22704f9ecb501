package llmbridge.apiprovider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.Locale;

/**
 * Image type detection and size checks applied before inline media is embedded in a request.
 * Parts that are not images or exceed a vendor limit are dropped, not errored.
 */
public final class MediaNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(MediaNormalizer.class);

    /** Returned by {@link #detect(byte[])} when no known signature matches. */
    public static final String FALLBACK_MEDIA_TYPE = "application/octet-stream";

    public static final long ANTHROPIC_IMAGE_LIMIT = 5L * 1024 * 1024;
    public static final long OPENAI_IMAGE_LIMIT = 20L * 1024 * 1024;
    public static final long GEMINI_INLINE_LIMIT = 20L * 1024 * 1024;
    public static final long OLLAMA_IMAGE_LIMIT = 20L * 1024 * 1024;

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] GIF87 = {'G', 'I', 'F', '8', '7', 'a'};
    private static final byte[] GIF89 = {'G', 'I', 'F', '8', '9', 'a'};
    private static final byte[] RIFF = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP = {'W', 'E', 'B', 'P'};

    private MediaNormalizer() {
    }

    /**
     * Detect an image MIME type from magic numbers.
     */
    public static String detect(byte[] data) {
        if (data == null) {
            return FALLBACK_MEDIA_TYPE;
        }
        if (startsWith(data, 0, PNG)) {
            return "image/png";
        }
        if (startsWith(data, 0, JPEG)) {
            return "image/jpeg";
        }
        if (startsWith(data, 0, GIF87) || startsWith(data, 0, GIF89)) {
            return "image/gif";
        }
        if (startsWith(data, 0, RIFF) && startsWith(data, 8, WEBP)) {
            return "image/webp";
        }
        return FALLBACK_MEDIA_TYPE;
    }

    public static boolean fits(byte[] data, long limit) {
        return data != null && data.length <= limit;
    }

    public static boolean isImage(String mediaType) {
        return mediaType != null && mediaType.toLowerCase(Locale.ROOT).startsWith("image/");
    }

    /**
     * Declared media type of the part, or the detected one when none was declared.
     */
    public static String resolveMediaType(MessagePart.FilePart part) {
        if (part.getMediaType() != null && !part.getMediaType().isEmpty()) {
            return part.getMediaType();
        }
        return part.hasData() ? detect(part.getData()) : FALLBACK_MEDIA_TYPE;
    }

    /**
     * Check an inline part against a vendor limit.
     * @return the media type to embed, or null when the part must be dropped
     */
    public static String admitInline(MessagePart.FilePart part, long limit, String providerName) {
        String mediaType = resolveMediaType(part);
        if (!isImage(mediaType)) {
            logger.warn("[{}] Dropping non-image attachment ({})", providerName, mediaType);
            return null;
        }
        if (part.getSize() > limit) {
            logger.warn("[{}] Dropping {} attachment of {} bytes, limit is {} bytes",
                providerName, mediaType, part.getSize(), limit);
            return null;
        }
        return mediaType;
    }

    public static String toBase64(MessagePart.FilePart part) {
        return Base64.getEncoder().encodeToString(part.getData());
    }

    private static boolean startsWith(byte[] data, int offset, byte[] signature) {
        if (data.length < offset + signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (data[offset + i] != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
