package fr.lapetina.veebot.infrastructure.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.veebot.domain.error.ErrorKind;
import fr.lapetina.veebot.domain.error.VeebotException;
import fr.lapetina.veebot.infrastructure.config.VeebotConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP client for JSON APIs.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Every failure surfaces as a
 * {@link VeebotException}:
 * - request not sent or not completed: {@link ErrorKind.SendRequest}
 * - 4xx/5xx status: {@link ErrorKind.GetRequest} with the body as text
 * - body not matching the expected type: {@link ErrorKind.UnexpectedJsonShape}
 *
 * The request timeout bounds the whole call, body included.
 * One request per call, no retries. Instances are thread-safe and meant to be shared.
 */
public class HttpJsonClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpJsonClient.class);

    public static final String DEFAULT_USER_AGENT = "Veebot";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    static final String BODY_READ_FAILURE = "Could not collect the GET request body: ";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final String userAgent;
    private final Duration requestTimeout;

    public HttpJsonClient(String userAgent, Duration connectTimeout, Duration requestTimeout) {
        this.userAgent = userAgent;
        this.requestTimeout = requestTimeout;

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "veebot-http-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .executor(executor)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public HttpJsonClient(VeebotConfig.HttpConfig config) {
        this(
                config.getUserAgent(),
                Duration.ofMillis(config.getConnectTimeoutMs()),
                Duration.ofMillis(config.getRequestTimeoutMs())
        );
    }

    public HttpJsonClient() {
        this(DEFAULT_USER_AGENT, DEFAULT_TIMEOUT, DEFAULT_TIMEOUT);
    }

    /**
     * Sends a GET request and deserializes the JSON response body.
     *
     * @param url   Target URL
     * @param query Query parameters appended to the URL
     * @param type  Expected shape of the response body
     * @return CompletableFuture with the parsed body, failed with a {@link VeebotException}
     */
    public <T> CompletableFuture<T> getJson(URI url, Map<String, String> query, Class<T> type) {
        return send(url, query, objectMapper.constructType(type));
    }

    public <T> CompletableFuture<T> getJson(URI url, Map<String, String> query, TypeReference<T> type) {
        return send(url, query, objectMapper.constructType(type));
    }

    private <T> CompletableFuture<T> send(URI url, Map<String, String> query, JavaType type) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(UrlBuilder.withQuery(url, query))
                    .timeout(requestTimeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(VeebotException.of(new ErrorKind.SendRequest(e)));
        }

        Call<T> call = new Call<>(type);
        call.exchange = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream());
        // Body reads block, so they run on our executor rather than the one completing the exchange
        call.exchange.whenCompleteAsync(call::onResponse, executor);

        // The request timeout of HttpRequest stops at the headers, this one covers the body too
        CompletableFuture<Void> deadline = new CompletableFuture<Void>()
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        deadline.whenComplete((ignored, timeout) -> {
            if (timeout != null) {
                call.fail(new ErrorKind.SendRequest(new HttpTimeoutException(
                        "Request timed out after " + requestTimeout.toMillis() + " ms: " + request.uri())));
                call.abort();
            }
        });

        call.result.whenComplete((value, failure) -> {
            deadline.complete(null);
            if (call.result.isCancelled()) {
                call.settled.set(true);
                call.abort();
            }
        });
        return call.result;
    }

    /**
     * State of one request, settled once. Only the side that settles it builds the error.
     */
    private final class Call<T> {

        private final JavaType type;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private final AtomicBoolean settled = new AtomicBoolean();
        private final AtomicReference<InputStream> body = new AtomicReference<>();
        private volatile CompletableFuture<HttpResponse<InputStream>> exchange;

        Call(JavaType type) {
            this.type = type;
        }

        void onResponse(HttpResponse<InputStream> response, Throwable failure) {
            if (failure != null) {
                fail(new ErrorKind.SendRequest(unwrap(failure)));
                return;
            }
            body.set(response.body());
            if (settled.get()) {
                abort();
                return;
            }

            int status = response.statusCode();
            if (isClientOrServerError(status)) {
                fail(new ErrorKind.GetRequest(status, readBodyAsText(response)));
                return;
            }

            T value;
            try (InputStream in = response.body()) {
                value = objectMapper.readValue(in, type);
            } catch (IOException e) {
                fail(new ErrorKind.UnexpectedJsonShape(e));
                return;
            }
            if (settled.compareAndSet(false, true)) {
                result.complete(value);
            }
        }

        void fail(ErrorKind kind) {
            if (!result.isDone() && settled.compareAndSet(false, true)) {
                result.completeExceptionally(VeebotException.of(kind));
            }
        }

        void abort() {
            CompletableFuture<HttpResponse<InputStream>> inFlight = exchange;
            if (inFlight != null) {
                inFlight.cancel(true);
            }
            InputStream in = body.getAndSet(null);
            if (in != null) {
                try {
                    in.close();
                } catch (IOException e) {
                    log.debug("Failed to close abandoned response body: {}", e.toString());
                }
            }
        }
    }

    private static String readBodyAsText(HttpResponse<InputStream> response) {
        try (InputStream body = response.body()) {
            return new String(body.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return BODY_READ_FAILURE + e;
        }
    }

    private static boolean isClientOrServerError(int status) {
        return status >= 400 && status < 600;
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
