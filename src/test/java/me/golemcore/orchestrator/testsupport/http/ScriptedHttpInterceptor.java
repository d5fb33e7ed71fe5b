package me.golemcore.orchestrator.testsupport.http;

import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * OkHttp interceptor that answers from a script instead of the network.
 * <p>
 * Tests enqueue responses or failures in order; every request that reaches the
 * interceptor is recorded with its body for later assertions.
 */
public final class ScriptedHttpInterceptor implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<Object> script = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<RecordedCall> calls = new ConcurrentLinkedQueue<>();

    public void enqueueJson(int code, String body) {
        script.add(new Reply(code, body != null ? body : ""));
    }

    public void enqueueFailure(IOException failure) {
        script.add(failure);
    }

    public RecordedCall takeCall() {
        return calls.poll();
    }

    public int getCallCount() {
        return calls.size();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        calls.add(new RecordedCall(request.method(), request.url(), request.headers(), bodyOf(request),
                Thread.currentThread().getName()));

        Object next = script.poll();
        if (next == null) {
            throw new IOException("Nothing scripted for " + request.method() + " " + request.url());
        }
        if (next instanceof IOException failure) {
            throw failure;
        }
        Reply reply = (Reply) next;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("scripted")
                .body(ResponseBody.create(reply.body(), JSON))
                .build();
    }

    private static String bodyOf(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Reply(int code, String body) {
    }

    public record RecordedCall(String method, HttpUrl url, Headers headers, String body, String threadName) {

        public String path() {
            return url.encodedPath();
        }

        public String queryParameter(String name) {
            return url.queryParameter(name);
        }

        public String header(String name) {
            return headers.get(name);
        }
    }
}
