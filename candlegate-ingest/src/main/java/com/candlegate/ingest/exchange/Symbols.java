package com.candlegate.ingest.exchange;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Symbol normalization between config, exchange and storage formats.
 */
public final class Symbols {

    // Longest first so "BUSD" wins over "USD"
    private static final List<String> KNOWN_QUOTES = List.of("USDT", "USDC", "BUSD", "USD", "BTC", "ETH", "BNB");

    private Symbols() {
    }

    /**
     * Normalize to canonical BASE/QUOTE form.
     * Examples: "BTCUSDT", "BTC_USDT", "btc-usdt" -> "BTC/USDT"
     */
    public static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is blank");
        }
        String s = symbol.trim().toUpperCase(Locale.ROOT)
            .replace('-', '/')
            .replace('_', '/')
            .replace(' ', '/');
        if (s.contains("/")) {
            return s;
        }
        for (String quote : KNOWN_QUOTES) {
            if (s.endsWith(quote) && s.length() > quote.length()) {
                return s.substring(0, s.length() - quote.length()) + "/" + quote;
            }
        }
        return s;
    }

    /**
     * Normalize a list, skipping blank entries.
     */
    public static List<String> normalizeAll(List<String> symbols) {
        List<String> result = new ArrayList<>();
        if (symbols == null) return result;
        for (String s : symbols) {
            if (s != null && !s.isBlank()) {
                result.add(normalize(s));
            }
        }
        return result;
    }

    /**
     * Directory name for a symbol: "/" replaced by "-".
     */
    public static String toPathSegment(String symbol) {
        return symbol.replace("/", "-");
    }
}
