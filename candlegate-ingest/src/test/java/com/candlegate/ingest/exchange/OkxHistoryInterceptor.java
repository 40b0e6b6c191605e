package com.candlegate.ingest.exchange;

import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Answers OKX candle requests from a fixed set of bar timestamps, honoring the
 * {@code before}/{@code after}/{@code limit} bounds the way the exchange does.
 * Every bar carries the same prices and volume.
 */
public final class OkxHistoryInterceptor implements Interceptor {

    private final NavigableSet<Long> timestamps;
    private final AtomicInteger requests = new AtomicInteger();

    public OkxHistoryInterceptor(List<Long> timestamps) {
        this.timestamps = new TreeSet<>(timestamps);
    }

    public OkxExchangeClient client() {
        OkHttpClient http = new OkHttpClient.Builder().addInterceptor(this).build();
        return new OkxExchangeClient(http, "https://okx.test");
    }

    public int getRequests() {
        return requests.get();
    }

    @Override
    public Response intercept(Chain chain) {
        requests.incrementAndGet();
        HttpUrl url = chain.request().url();
        long before = Long.parseLong(url.queryParameter("before"));
        long after = Long.parseLong(url.queryParameter("after"));
        int limit = Integer.parseInt(url.queryParameter("limit"));

        StringBuilder body = new StringBuilder("{\"code\":\"0\",\"msg\":\"\",\"data\":[");
        int served = 0;
        for (Long ts : timestamps.subSet(before, false, after, false).descendingSet()) {
            if (served == limit) {
                break;
            }
            if (served > 0) {
                body.append(',');
            }
            body.append("[\"").append(ts).append("\",\"100\",\"101\",\"99\",\"100.5\",\"10\",\"1000\",\"1000\",\"1\"]");
            served++;
        }
        body.append("]}");

        return new Response.Builder()
            .request(chain.request())
            .protocol(Protocol.HTTP_1_1)
            .code(200)
            .message("OK")
            .body(ResponseBody.create(body.toString(), MediaType.get("application/json")))
            .build();
    }
}
