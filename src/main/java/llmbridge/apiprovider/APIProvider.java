package llmbridge.apiprovider;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import llmbridge.apiprovider.capabilities.ChatProvider;
import llmbridge.apiprovider.capabilities.StructuredOutputProvider;
import llmbridge.apiprovider.exceptions.*;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared transport, error mapping and streaming plumbing for the four vendor adapters.
 * Subclasses own encoding, response parsing and their stream decoder.
 */
public abstract class APIProvider implements ChatProvider, StructuredOutputProvider {
    public enum ProviderType {
        ANTHROPIC("https://api.anthropic.com/", "claude-sonnet-4-20250514"),
        OPENAI("https://api.openai.com/v1/", "gpt-4o"),
        GEMINI("https://generativelanguage.googleapis.com/", "gemini-2.5-flash"),
        OLLAMA("http://localhost:11434/", "llama3.1");

        private final String defaultUrl;
        private final String defaultModel;

        ProviderType(String defaultUrl, String defaultModel) {
            this.defaultUrl = defaultUrl;
            this.defaultModel = defaultModel;
        }

        public String getDefaultUrl() { return defaultUrl; }
        public String getDefaultModel() { return defaultModel; }

        public static ProviderType fromString(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Provider type is required");
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown provider type: " + value, e);
            }
        }
    }

    private static final Logger logger = LoggerFactory.getLogger(APIProvider.class);

    protected static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();
    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String EXECUTE_ONCE = "executeOnce";
    private static final String EXECUTE_STREAMING = "executeStreaming";

    protected String name;
    protected String model;
    protected Integer maxTokens;
    protected String url;
    protected String key;
    protected boolean disableTlsVerification;
    protected ProviderType type;
    protected OkHttpClient client;
    protected Duration timeout;
    protected RetryHandler retryHandler;
    protected ReasoningConfig reasoningConfig;
    protected CallObserver observer;

    protected APIProvider(APIProviderConfig config, ProviderType type) {
        APIProviderConfig resolved = config.withDefaults();
        if (resolved.getType() != type) {
            throw new IllegalArgumentException("Config for " + resolved.getType() + " passed to a " + type + " provider");
        }
        this.name = resolved.getName();
        this.type = type;
        this.model = resolved.getModel();
        this.maxTokens = resolved.getMaxTokens();
        this.url = resolved.getUrl().endsWith("/") ? resolved.getUrl() : resolved.getUrl() + "/";
        this.key = resolved.getKey();
        this.disableTlsVerification = resolved.isDisableTlsVerification();
        this.timeout = Duration.ofSeconds(resolved.getTimeout());
        this.reasoningConfig = new ReasoningConfig(resolved.getReasoningEffort());
        this.observer = new APIProviderLogger();
        this.retryHandler = new RetryHandler(resolved.getMaxRetries(), name, observer);
        this.client = buildClient();
    }

    // Getters
    public String getName() { return name; }
    public ProviderType getType() { return type; }
    public String getModel() { return model; }
    public Integer getMaxTokens() { return maxTokens; }
    public String getUrl() { return url; }
    public boolean isDisableTlsVerification() { return disableTlsVerification; }
    public Duration getTimeout() { return timeout; }
    public ReasoningConfig getReasoningConfig() { return reasoningConfig; }
    public CallObserver getCallObserver() { return observer; }

    /**
     * Replace the metrics/tracing sink. Null restores the logging default.
     */
    public void setCallObserver(CallObserver observer) {
        this.observer = observer != null ? observer : new APIProviderLogger();
        this.retryHandler = new RetryHandler(retryHandler.getMaxRetries(), name, this.observer);
    }

    /**
     * Add the vendor's authentication and versioning headers to every request.
     */
    protected abstract void addAuthHeaders(Request.Builder builder);

    /**
     * Parse one complete (non-streaming) response document.
     */
    protected abstract CompletionResult parseCompletion(JsonObject response) throws APIProviderException;

    /**
     * Fresh decoder for one stream; never shared between streams.
     */
    protected abstract StreamDecoder newStreamDecoder();

    protected StreamFrameReader.Format streamFormat() {
        return StreamFrameReader.Format.SSE;
    }

    /**
     * A reduced request to try once when the vendor rejects {@code request} with {@code error},
     * or null when the error is final. Implementations must not modify {@code request}.
     */
    protected WireRequest fallbackRequest(WireRequest request, APIProviderException error) {
        return null;
    }

    protected GenerationOptions resolveOptions(GenerationOptions options) {
        return GenerationOptions.withDefaults(options, model, maxTokens, reasoningConfig);
    }

    /**
     * Encode and execute in one step (blocking).
     */
    public CompletionResult createCompletion(List<ChatMessage> messages, List<ToolDefinition> tools,
                                             GenerationOptions options) throws APIProviderException {
        return executeOnce(encode(messages, tools, false, options));
    }

    /**
     * Encode and start streaming in one step.
     */
    public EventStream streamCompletion(List<ChatMessage> messages, List<ToolDefinition> tools,
                                        GenerationOptions options) throws APIProviderException {
        return executeStreaming(encode(messages, tools, true, options));
    }

    @Override
    public CompletionResult executeOnce(WireRequest request) throws APIProviderException {
        if (request.isStreaming()) {
            throw new IllegalArgumentException("Request was encoded for streaming: " + request);
        }
        long started = System.nanoTime();
        try {
            String body;
            try {
                body = executeForBody(request, EXECUTE_ONCE);
            } catch (APIProviderException e) {
                WireRequest fallback = fallbackRequest(request, e);
                if (fallback == null) {
                    throw e;
                }
                body = executeForBody(fallback, EXECUTE_ONCE);
            }
            CompletionResult result = parseCompletion(parseJson(body, EXECUTE_ONCE));
            observer.onCallSucceeded(name, EXECUTE_ONCE, elapsedSince(started), result.getTokensUsed());
            return result;
        } catch (APIProviderException e) {
            observer.onCallFailed(name, EXECUTE_ONCE, elapsedSince(started), e);
            throw e;
        }
    }

    @Override
    public EventStream executeStreaming(WireRequest request) throws APIProviderException {
        if (!request.isStreaming()) {
            throw new IllegalArgumentException("Request was not encoded for streaming: " + request);
        }
        EventStream stream = new EventStream(name);
        startStream(request, stream, true, System.nanoTime());
        return stream;
    }

    /**
     * Issue the request on OkHttp's dispatcher; the callback thread owns the response body
     * and the decoder for the life of the stream.
     */
    private void startStream(WireRequest request, EventStream stream, boolean fallbackAllowed, long started) {
        Request httpRequest = buildHttpRequest(request);
        logger.debug("[{}] Streaming POST {}", name, httpRequest.url());

        Call call = client.newCall(httpRequest);
        stream.attach(call);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                if (stream.isCancelled()) {
                    reportCancelled(started);
                    return;
                }
                fail(stream, handleNetworkError(e, EXECUTE_STREAMING), started);
            }

            @Override
            public void onResponse(Call call, Response response) {
                boolean handedOff = false;
                try (ResponseBody responseBody = response.body()) {
                    if (!response.isSuccessful()) {
                        String errorBody = responseBody != null ? responseBody.string() : null;
                        APIProviderException error = handleHttpError(response, errorBody, EXECUTE_STREAMING);
                        WireRequest fallback = fallbackAllowed ? fallbackRequest(request, error) : null;
                        if (fallback != null && !stream.isCancelled()) {
                            handedOff = true;
                            startStream(fallback, stream, false, started);
                        } else {
                            fail(stream, error, started);
                        }
                        return;
                    }
                    if (responseBody == null) {
                        fail(stream, new ResponseException(name, EXECUTE_STREAMING,
                            ResponseException.ResponseErrorType.EMPTY_RESPONSE), started);
                        return;
                    }
                    decode(responseBody, stream, started);
                } catch (IOException e) {
                    if (!stream.isCancelled()) {
                        fail(stream, handleNetworkError(e, EXECUTE_STREAMING), started);
                    }
                } catch (RuntimeException e) {
                    fail(stream, new ResponseException(name, EXECUTE_STREAMING,
                        ResponseException.ResponseErrorType.UNEXPECTED_FORMAT, e), started);
                } finally {
                    if (!handedOff && !stream.isTerminated()) {
                        if (stream.isCancelled()) {
                            reportCancelled(started);
                        } else {
                            fail(stream, new ResponseException(name, EXECUTE_STREAMING,
                                ResponseException.ResponseErrorType.STREAM_INTERRUPTED), started);
                        }
                    }
                }
            }
        });
    }

    private void decode(ResponseBody responseBody, EventStream stream, long started) throws IOException {
        StreamDecoder decoder = newStreamDecoder();
        StreamEventSink sink = event -> {
            if (event.getType() == StreamEvent.Type.ERROR && !stream.isTerminated()) {
                observer.onCallFailed(name, EXECUTE_STREAMING, elapsedSince(started), event.getError());
            }
            return stream.emit(event);
        };

        new StreamFrameReader(responseBody.source(), streamFormat())
            .read((eventType, data) -> decoder.onFrame(eventType, data, sink),
                  () -> stream.isCancelled() || stream.isTerminated());

        if (stream.isCancelled() || stream.isTerminated()) {
            return;
        }
        if (!decoder.isComplete()) {
            logger.warn("[{}] Response stream ended before the provider finished it", name);
            fail(stream, new ResponseException(name, EXECUTE_STREAMING,
                ResponseException.ResponseErrorType.STREAM_INTERRUPTED, "body ended without an end marker"), started);
            return;
        }
        decoder.onEnd(sink);
        observer.onCallSucceeded(name, EXECUTE_STREAMING, elapsedSince(started), decoder.getTokensUsed());
    }

    private void fail(EventStream stream, APIProviderException error, long started) {
        observer.onCallFailed(name, EXECUTE_STREAMING, elapsedSince(started), error);
        stream.emit(StreamEvent.error(error));
    }

    private void reportCancelled(long started) {
        observer.onCallFailed(name, EXECUTE_STREAMING, elapsedSince(started),
            new StreamCancelledException(name, EXECUTE_STREAMING, StreamCancelledException.CancellationReason.USER_REQUESTED));
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    protected OkHttpClient buildClient() {
        try {
            OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .retryOnConnectionFailure(true)
                .addInterceptor(chain -> {
                    Request.Builder requestBuilder = chain.request().newBuilder()
                        .header("Content-Type", "application/json");
                    addAuthHeaders(requestBuilder);
                    return chain.proceed(requestBuilder.build());
                });

            if (disableTlsVerification) {
                TrustManager[] trustAllCerts = new TrustManager[]{
                    new X509TrustManager() {
                        @Override
                        public void checkClientTrusted(java.security.cert.X509Certificate[] chain, String authType) {}
                        @Override
                        public void checkServerTrusted(java.security.cert.X509Certificate[] chain, String authType) {}
                        @Override
                        public java.security.cert.X509Certificate[] getAcceptedIssuers() {
                            return new java.security.cert.X509Certificate[]{};
                        }
                    }
                };

                SSLContext sslContext = SSLContext.getInstance("TLS");
                sslContext.init(null, trustAllCerts, new java.security.SecureRandom());
                builder.sslSocketFactory(sslContext.getSocketFactory(), (X509TrustManager) trustAllCerts[0])
                       .hostnameVerifier((hostname, session) -> true);
            }

            return builder.build();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build HTTP client", e);
        }
    }

    protected Request buildHttpRequest(WireRequest request) {
        Request.Builder builder = new Request.Builder()
            .url(url + request.getEndpoint())
            .post(RequestBody.create(gson.toJson(request.getBody()), JSON));
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    /**
     * Execute an HTTP request with retry logic for handling rate limits and transient errors
     */
    protected String executeForBody(WireRequest request, String operation) throws APIProviderException {
        Request httpRequest = buildHttpRequest(request);
        logger.debug("[{}] POST {}", name, httpRequest.url());

        return retryHandler.executeWithRetryCallable(() -> {
            try (Response response = client.newCall(httpRequest).execute()) {
                ResponseBody responseBody = response.body();
                String body = responseBody != null ? responseBody.string() : "";
                if (!response.isSuccessful()) {
                    throw handleHttpError(response, body, operation);
                }
                return body;
            } catch (IOException e) {
                throw handleNetworkError(e, operation);
            }
        }, operation);
    }

    protected JsonObject parseJson(String body, String operation) throws ResponseException {
        if (body == null || body.trim().isEmpty()) {
            throw new ResponseException(name, operation, ResponseException.ResponseErrorType.EMPTY_RESPONSE);
        }
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(body);
        } catch (JsonParseException e) {
            throw new ResponseException(name, operation, ResponseException.ResponseErrorType.MALFORMED_JSON, e);
        }
        if (!parsed.isJsonObject()) {
            throw new ResponseException(name, operation, ResponseException.ResponseErrorType.UNEXPECTED_FORMAT,
                "expected a JSON object");
        }
        return parsed.getAsJsonObject();
    }

    /**
     * Handle network-related exceptions and convert to appropriate APIProviderException
     */
    protected APIProviderException handleNetworkError(Exception e, String operation) {
        if (e instanceof SocketTimeoutException) {
            return new NetworkException(name, operation, NetworkException.NetworkErrorType.TIMEOUT, e);
        } else if (e instanceof SSLException) {
            return new NetworkException(name, operation, NetworkException.NetworkErrorType.SSL_ERROR, e);
        } else if (e instanceof ConnectException) {
            return new NetworkException(name, operation, NetworkException.NetworkErrorType.CONNECTION_FAILED, e);
        } else if (e instanceof UnknownHostException) {
            return new NetworkException(name, operation, NetworkException.NetworkErrorType.DNS_ERROR, e);
        } else if (e instanceof IOException && e.getMessage() != null &&
                   e.getMessage().toLowerCase(Locale.ROOT).contains("connection")) {
            return new NetworkException(name, operation, NetworkException.NetworkErrorType.CONNECTION_LOST, e);
        }

        // Default network error
        return new NetworkException(name, operation, "Network error: " + e.getMessage(), e);
    }

    /**
     * Handle HTTP response errors with preread response body. The vendor's error code and
     * message are carried on the returned exception.
     */
    protected APIProviderException handleHttpError(Response response, String responseBody, String operation) {
        int statusCode = response.code();
        String apiErrorCode = extractApiErrorCode(responseBody);
        String errorMessage = extractErrorMessage(responseBody, statusCode);

        switch (statusCode) {
            case 401:
                return new AuthenticationException(name, operation, statusCode, apiErrorCode,
                    errorMessage != null ? errorMessage : "Invalid or missing API key");

            case 403:
                return new AuthenticationException(name, operation, statusCode, apiErrorCode,
                    errorMessage != null ? errorMessage : "API key does not have sufficient permissions");

            case 429:
                Integer retryAfter = extractRetryAfter(response);
                return new RateLimitException(name, operation, statusCode, apiErrorCode,
                    errorMessage != null ? errorMessage : "Rate limit exceeded", retryAfter);

            case 400:
                String lower = errorMessage != null ? errorMessage.toLowerCase(Locale.ROOT) : "";
                if (lower.contains("context length") || lower.contains("context window")) {
                    return new ModelException(name, operation, ModelException.ModelErrorType.CONTEXT_LENGTH_EXCEEDED,
                        statusCode, apiErrorCode, errorMessage);
                } else if (lower.contains("max_tokens") || lower.contains("maximum tokens")) {
                    return new ModelException(name, operation, ModelException.ModelErrorType.TOKEN_LIMIT_EXCEEDED,
                        statusCode, apiErrorCode, errorMessage);
                }
                return new APIProviderException(APIProviderException.ErrorCategory.CONFIGURATION,
                    name, operation, statusCode, apiErrorCode,
                    errorMessage != null ? errorMessage : "Bad request");

            case 404:
                return new ModelException(name, operation, ModelException.ModelErrorType.MODEL_NOT_FOUND,
                    statusCode, apiErrorCode, errorMessage);

            case 529:
                return new ModelException(name, operation, ModelException.ModelErrorType.MODEL_OVERLOADED,
                    statusCode, apiErrorCode, errorMessage);

            case 500:
            case 502:
            case 503:
            case 504:
                return new APIProviderException(APIProviderException.ErrorCategory.SERVICE_ERROR,
                    name, operation, statusCode, apiErrorCode,
                    errorMessage != null ? errorMessage : "Service error", true, null, null);

            default:
                return new APIProviderException(APIProviderException.ErrorCategory.SERVICE_ERROR,
                    name, operation, statusCode, apiErrorCode,
                    errorMessage != null ? errorMessage : "HTTP error " + statusCode);
        }
    }

    /**
     * Extract the vendor error code from an error body. Defaults to {@code error.code},
     * then {@code error.type}.
     */
    protected String extractApiErrorCode(String responseBody) {
        JsonObject error = errorObject(responseBody);
        if (error == null) {
            return null;
        }
        String code = JsonFields.getString(error, "code");
        return code != null ? code : JsonFields.getString(error, "type");
    }

    /**
     * Extract the vendor error message: {@code error.message}, a string-valued
     * {@code error}, or the (truncated) raw body.
     */
    protected String extractErrorMessage(String responseBody, int statusCode) {
        if (responseBody == null || responseBody.isEmpty()) {
            return null;
        }
        JsonObject parsed = parseErrorBody(responseBody);
        if (parsed != null && parsed.has("error")) {
            JsonElement error = parsed.get("error");
            if (error.isJsonPrimitive()) {
                return error.getAsString();
            }
            String message = JsonFields.getString(JsonFields.getObject(parsed, "error"), "message");
            if (message != null) {
                return message;
            }
        }

        // Fallback: return truncated response body
        return responseBody.length() > 200 ? responseBody.substring(0, 200) + "..." : responseBody;
    }

    /**
     * The {@code error} object of an error body, or null.
     */
    protected JsonObject errorObject(String responseBody) {
        return JsonFields.getObject(parseErrorBody(responseBody), "error");
    }

    private JsonObject parseErrorBody(String responseBody) {
        if (responseBody == null || responseBody.isEmpty()) {
            return null;
        }
        try {
            JsonElement parsed = JsonParser.parseString(responseBody);
            return parsed.isJsonObject() ? parsed.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            logger.debug("[{}] Error body is not JSON: {}", name, e.getMessage());
            return null;
        }
    }

    /**
     * Extract retry-after seconds from the Retry-After header
     */
    protected Integer extractRetryAfter(Response response) {
        String retryAfterHeader = response.header("Retry-After");
        if (retryAfterHeader != null) {
            try {
                return Integer.parseInt(retryAfterHeader.trim());
            } catch (NumberFormatException e) {
                logger.debug("[{}] Ignoring non-numeric Retry-After: {}", name, retryAfterHeader);
            }
        }
        return null;
    }
}
