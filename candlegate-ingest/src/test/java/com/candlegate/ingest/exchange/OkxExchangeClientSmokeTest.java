package com.candlegate.ingest.exchange;

import com.candlegate.core.model.FetchWindow;
import com.candlegate.core.model.Interval;
import com.candlegate.core.model.RawBar;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hits the live OKX API to verify response parsing.
 * Tagged "integration" so it doesn't run on every build.
 */
@Tag("integration")
@Timeout(30)
class OkxExchangeClientSmokeTest {

    @Test
    void recentCandles() throws Exception {
        var client = new OkxExchangeClient();
        Interval interval = Interval.parse("15min");
        long since = System.currentTimeMillis() - 6 * interval.millis();
        since -= since % interval.millis();

        FetchWindow window = client.fetchWindow("BTC/USDT", interval, since, 5);

        assertFalse(window.isEmpty(), "OKX should return candles");
        RawBar first = window.rows().get(0);
        assertTrue(first.timestamp() >= since, "Timestamp in range");
        assertTrue(first.get(RawBar.HIGH) >= first.get(RawBar.LOW), "High >= Low");
        for (int i = 1; i < window.rows().size(); i++) {
            assertTrue(window.rows().get(i).timestamp() > window.rows().get(i - 1).timestamp(),
                "Candles should be chronological");
        }
    }

    @Test
    void historyCandles() throws Exception {
        var client = new OkxExchangeClient();
        Interval interval = Interval.parse("1h");
        long since = 1_704_067_200_000L; // 2024-01-01

        FetchWindow window = client.fetchWindow("BTC/USDT", interval, since, 24);

        assertFalse(window.isEmpty(), "History endpoint should cover 2024-01-01");
        assertEquals(since, window.rows().get(0).timestamp());
    }
}
