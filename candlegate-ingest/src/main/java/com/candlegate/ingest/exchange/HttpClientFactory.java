package com.candlegate.ingest.exchange;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared HTTP client and JSON mapper.
 *
 * One connection pool serves every exchange client; per-exchange timeouts are derived from it
 * with {@link #withTimeout(long)}. OkHttp never retries on its own: the fetcher owns retries
 * so that every attempt goes through the rate limiter and is counted.
 */
public final class HttpClientFactory {

    static final String USER_AGENT = "candlegate/1.0";
    private static final long DEFAULT_TIMEOUT_SECONDS = 30;

    private static final OkHttpClient SHARED_CLIENT = new OkHttpClient.Builder()
        .connectionPool(new ConnectionPool(8, 5, TimeUnit.MINUTES))
        .connectTimeout(Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS))
        .readTimeout(Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS))
        .retryOnConnectionFailure(false)
        .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
            .header("User-Agent", USER_AGENT)
            .build()))
        .build();

    // Exchange responses and manifest files
    private static final ObjectMapper SHARED_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private HttpClientFactory() {
    }

    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    /**
     * Client sharing the pool but bounding connect, read and whole-call time.
     */
    public static OkHttpClient withTimeout(long timeoutSeconds) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        return SHARED_CLIENT.newBuilder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .callTimeout(timeout.multipliedBy(2))
            .build();
    }

    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
