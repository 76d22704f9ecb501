package llmbridge.apiprovider;

import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An encoded vendor request: endpoint path relative to the provider URL, JSON body,
 * and any per-request headers. Treat as read-only; use {@link #copy()} before changing it.
 */
public final class WireRequest {
    private final APIProvider.ProviderType providerType;
    private final String endpoint;
    private final JsonObject body;
    private final boolean streaming;
    private final Map<String, String> headers;

    public WireRequest(APIProvider.ProviderType providerType, String endpoint, JsonObject body,
                       boolean streaming, Map<String, String> headers) {
        this.providerType = providerType;
        this.endpoint = endpoint;
        this.body = body;
        this.streaming = streaming;
        this.headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Collections.emptyMap();
    }

    public APIProvider.ProviderType getProviderType() { return providerType; }
    public String getEndpoint() { return endpoint; }
    public JsonObject getBody() { return body; }
    public boolean isStreaming() { return streaming; }
    public Map<String, String> getHeaders() { return headers; }

    /**
     * Deep copy; changes to the copy's body never reach this request.
     */
    public WireRequest copy() {
        return new WireRequest(providerType, endpoint, body.deepCopy(), streaming, headers);
    }

    @Override
    public String toString() {
        return "WireRequest{" + providerType + " " + endpoint + (streaming ? " (stream)" : "") + "}";
    }
}
