package me.golemcore.gurgeh.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory OkHttp exchange engine for unit tests.
 * <p>
 * Never touches the network. Tests enqueue responses or failures, and every
 * request that reaches the engine is captured.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Request> capturedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public void enqueueText(int code, String body, String contentType) {
        plannedResults.add(new PlannedResult(code, body != null ? body.getBytes(StandardCharsets.UTF_8)
                : new byte[0], contentType, Headers.of(), null));
    }

    public void enqueueRedirect(int code, String location) {
        plannedResults.add(new PlannedResult(code, new byte[0], null, Headers.of("Location", location), null));
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(new PlannedResult(0, new byte[0], null, Headers.of(), failure));
    }

    public Request takeRequest() {
        return capturedRequests.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        capturedRequests.add(request);
        requestCount.incrementAndGet();

        PlannedResult planned = plannedResults.poll();
        if (planned == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (planned.failure() != null) {
            throw planned.failure();
        }

        MediaType mediaType = planned.contentType() != null ? MediaType.parse(planned.contentType()) : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(planned.code())
                .message("mock")
                .headers(planned.headers())
                .body(ResponseBody.create(planned.body(), mediaType))
                .build();
    }

    private record PlannedResult(int code, byte[] body, String contentType, Headers headers, IOException failure) {
    }
}
