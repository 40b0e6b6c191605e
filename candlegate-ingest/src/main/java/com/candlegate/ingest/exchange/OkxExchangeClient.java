package com.candlegate.ingest.exchange;

import com.candlegate.core.model.FetchWindow;
import com.candlegate.core.model.Interval;
import com.candlegate.core.model.RawBar;
import com.candlegate.ingest.exchange.exception.ExchangeException;
import com.candlegate.ingest.exchange.exception.RateLimitException;
import com.candlegate.ingest.exchange.exception.TransientNetworkException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * OKX exchange client using the public V5 market endpoints.
 *
 * API docs: https://www.okx.com/docs-v5/en/
 */
public class OkxExchangeClient implements ExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(OkxExchangeClient.class);

    public static final String EXCHANGE_ID = "okx";
    public static final String DEFAULT_BASE_URL = "https://www.okx.com";

    private static final int MAX_CANDLES_PER_REQUEST = 300;
    private static final int MAX_HISTORY_CANDLES_PER_REQUEST = 100;

    // 50011: too many requests. 50001/50013: service temporarily unavailable / system busy
    private static final String CODE_RATE_LIMITED = "50011";
    private static final Set<String> CODES_TRANSIENT = Set.of("50001", "50013");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public OkxExchangeClient() {
        this(HttpClientFactory.getClient(), DEFAULT_BASE_URL);
    }

    public OkxExchangeClient(OkHttpClient client, String baseUrl) {
        this.client = client;
        this.mapper = HttpClientFactory.getMapper();
        this.baseUrl = baseUrl;
    }

    @Override
    public String getExchangeId() {
        return EXCHANGE_ID;
    }

    @Override
    public int getMaxCandlesPerRequest() {
        return MAX_CANDLES_PER_REQUEST;
    }

    /**
     * Map intervals to OKX bar format. Hour and longer bars use uppercase units,
     * day and week bars use the UTC-aligned variants.
     */
    @Override
    public String timeframeToken(Interval interval) {
        return switch (interval.unit()) {
            case 'm' -> interval.amount() + "m";
            case 'h' -> interval.amount() + "H";
            case 'd' -> interval.amount() + "Dutc";
            case 'w' -> interval.amount() + "Wutc";
            default -> throw new IllegalArgumentException("Unsupported OKX interval: " + interval);
        };
    }

    /**
     * Convert canonical "BTC/USDT" to the OKX instrument id "BTC-USDT".
     */
    static String toInstId(String symbol) {
        return Symbols.normalize(symbol).replace('/', '-');
    }

    @Override
    public FetchWindow fetchWindow(String symbol, Interval interval, long since, int limit)
            throws ExchangeException {
        int effectiveLimit = Math.max(1, Math.min(limit, MAX_CANDLES_PER_REQUEST));

        List<RawBar> rows = fetchCandles("/api/v5/market/candles", symbol, interval, since, effectiveLimit);
        if (rows.isEmpty()) {
            // Recent endpoint only covers the last few days; older data lives in history-candles
            effectiveLimit = Math.min(effectiveLimit, MAX_HISTORY_CANDLES_PER_REQUEST);
            rows = fetchCandles("/api/v5/market/history-candles", symbol, interval, since, effectiveLimit);
        }

        // Each request covers a fixed time range, so a short page only means the exchange
        // has holes in it. Paging stops once both endpoints return nothing.
        OptionalLong next = rows.isEmpty()
            ? OptionalLong.empty()
            : OptionalLong.of(rangeEnd(since, effectiveLimit, interval));
        log.debug("OKX {} {} since {}: {} rows", symbol, interval, since, rows.size());
        return new FetchWindow(rows, next);
    }

    static long rangeEnd(long since, int limit, Interval interval) {
        return since + limit * interval.millis();
    }

    private List<RawBar> fetchCandles(String path, String symbol, Interval interval, long since, int limit)
            throws ExchangeException {

        // OKX uses 'before' (return data newer than ts) and 'after' (return data older than ts).
        // Bounding both sides makes the page start at 'since' instead of at the newest bar.
        long windowEnd = rangeEnd(since, limit, interval);
        String url = baseUrl + path
            + "?instId=" + toInstId(symbol)
            + "&bar=" + timeframeToken(interval)
            + "&limit=" + limit
            + "&before=" + (since - 1)
            + "&after=" + windowEnd;

        Request request = new Request.Builder()
            .url(url)
            .get()
            .build();

        String body;
        try (Response response = client.newCall(request).execute()) {
            if (response.code() == 429) {
                throw new RateLimitException("OKX rate limit: HTTP 429", parseRetryAfter(response.header("Retry-After")));
            }
            if (response.code() >= 500) {
                throw new TransientNetworkException("OKX API error: " + response.code() + " " + response.message());
            }
            if (!response.isSuccessful()) {
                throw new ExchangeException("OKX API error: " + response.code() + " " + response.message());
            }
            body = response.body() != null ? response.body().string() : "";
        } catch (IOException e) {
            throw new TransientNetworkException("OKX request failed: " + e.getMessage(), e);
        }

        return parseCandles(body);
    }

    /**
     * Parse an OKX candles response body into rows, oldest first.
     * Kline format: [ts, o, h, l, c, vol, volCcy, volCcyQuote, confirm]
     */
    List<RawBar> parseCandles(String body) throws ExchangeException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new ExchangeException("OKX returned malformed JSON", e);
        }

        String code = root.has("code") ? root.get("code").asText() : "-1";
        if (!"0".equals(code)) {
            String msg = root.has("msg") ? root.get("msg").asText() : "Unknown error";
            if (CODE_RATE_LIMITED.equals(code)) {
                throw new RateLimitException("OKX rate limit: " + code + " " + msg, 0);
            }
            if (CODES_TRANSIENT.contains(code)) {
                throw new TransientNetworkException("OKX API error: " + code + " " + msg);
            }
            throw new ExchangeException("OKX API error: " + code + " " + msg);
        }

        JsonNode data = root.get("data");
        if (data == null || !data.isArray()) {
            return new ArrayList<>();
        }

        List<RawBar> rows = new ArrayList<>();
        for (JsonNode kline : data) {
            long timestamp;
            try {
                timestamp = Long.parseLong(kline.path(0).asText());
            } catch (NumberFormatException e) {
                throw new ExchangeException("OKX kline without a valid timestamp: " + kline, e);
            }
            Map<String, Double> values = new LinkedHashMap<>();
            putIfPresent(values, RawBar.OPEN, kline, 1);
            putIfPresent(values, RawBar.HIGH, kline, 2);
            putIfPresent(values, RawBar.LOW, kline, 3);
            putIfPresent(values, RawBar.CLOSE, kline, 4);
            putIfPresent(values, RawBar.VOLUME, kline, 5);
            rows.add(new RawBar(timestamp, values));
        }

        // OKX returns newest first, reverse for chronological order
        Collections.reverse(rows);
        return rows;
    }

    private static void putIfPresent(Map<String, Double> values, String column, JsonNode kline, int index) {
        if (!kline.has(index) || kline.get(index).isNull()) {
            return;
        }
        String text = kline.get(index).asText().trim();
        if (text.isEmpty()) {
            values.put(column, Double.NaN);
            return;
        }
        try {
            values.put(column, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            log.warn("Unparseable {} value '{}' in OKX kline", column, text);
            values.put(column, Double.NaN);
        }
    }

    private static long parseRetryAfter(String header) {
        if (header == null) return 0;
        try {
            return Long.parseLong(header.trim()) * 1000;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
