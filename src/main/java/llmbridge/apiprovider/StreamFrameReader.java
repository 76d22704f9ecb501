package llmbridge.apiprovider;

import okio.BufferedSource;

import java.io.IOException;
import java.util.function.BooleanSupplier;

/**
 * Splits a streaming response body into frames: Server-Sent Events, or newline-delimited JSON.
 */
public class StreamFrameReader {

    public enum Format {
        SSE,
        NDJSON
    }

    public interface FrameHandler {
        /**
         * @return false to stop reading
         */
        boolean onFrame(String eventType, String data);
    }

    private static final String DONE_SENTINEL = "[DONE]";

    private final BufferedSource source;
    private final Format format;

    public StreamFrameReader(BufferedSource source, Format format) {
        this.source = source;
        this.format = format;
    }

    /**
     * Read until the body is exhausted, the handler asks to stop, or {@code cancelled} turns true.
     */
    public void read(FrameHandler handler, BooleanSupplier cancelled) throws IOException {
        if (format == Format.NDJSON) {
            readLines(handler, cancelled);
        } else {
            readEvents(handler, cancelled);
        }
    }

    private void readLines(FrameHandler handler, BooleanSupplier cancelled) throws IOException {
        while (!cancelled.getAsBoolean() && !source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null) {
                break;
            }
            line = line.trim();
            if (line.isEmpty()) continue;

            if (!handler.onFrame(null, line)) {
                return;
            }
        }
    }

    private void readEvents(FrameHandler handler, BooleanSupplier cancelled) throws IOException {
        String eventType = null;
        StringBuilder data = null;

        while (!cancelled.getAsBoolean() && !source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null) {
                break;
            }

            if (line.isEmpty()) {
                // Blank line dispatches the pending event
                if (data != null && !dispatch(handler, eventType, data.toString())) {
                    return;
                }
                eventType = null;
                data = null;
                continue;
            }

            // Comment / keep-alive
            if (line.startsWith(":")) continue;

            if (line.startsWith("event:")) {
                eventType = fieldValue(line, 6);
            } else if (line.startsWith("data:")) {
                String value = fieldValue(line, 5);
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            }
        }

        if (data != null && !cancelled.getAsBoolean()) {
            dispatch(handler, eventType, data.toString());
        }
    }

    private static boolean dispatch(FrameHandler handler, String eventType, String data) {
        if (DONE_SENTINEL.equals(data.trim())) {
            return false;
        }
        if (data.trim().isEmpty()) {
            return true;
        }
        return handler.onFrame(eventType, data);
    }

    private static String fieldValue(String line, int prefixLength) {
        String value = line.substring(prefixLength);
        return value.startsWith(" ") ? value.substring(1) : value;
    }
}
