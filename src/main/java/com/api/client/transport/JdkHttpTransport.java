package com.api.client.transport;

import com.api.client.context.RequestContext;
import com.api.client.exception.ApiClientException;
import com.api.client.exception.RequestCancelledException;
import com.api.client.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link HttpTransport} on top of the JDK {@link HttpClient}.
 *
 * <p>The exchange runs asynchronously while the calling thread waits on it, re-checking the
 * request context at short intervals. When the context ends first the exchange is cancelled
 * and the caller gets a {@link RequestCancelledException}.</p>
 */
public class JdkHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private static final long CANCELLATION_CHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final HttpClient httpClient;

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    /**
     * Creates a transport over a default {@link HttpClient} that follows normal redirects.
     */
    public static JdkHttpTransport createDefault() {
        return new JdkHttpTransport(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    @Override
    public HttpResponse<InputStream> send(HttpRequest request, RequestContext context) {
        context.throwIfDone();

        CompletableFuture<HttpResponse<InputStream>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream());
        try {
            while (true) {
                long waitNanos = Math.max(0, Math.min(CANCELLATION_CHECK_NANOS, context.remainingNanos()));
                try {
                    return exchange.get(waitNanos, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    RequestCancelledException cancelled = context.error();
                    if (cancelled != null) {
                        exchange.cancel(true);
                        log.debug("Request {} {} abandoned: {}", request.method(), request.uri().getPath(),
                                cancelled.getMessage());
                        throw cancelled;
                    }
                }
            }
        } catch (InterruptedException e) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(RequestCancelledException.Reason.CANCELLED, e);
        } catch (ExecutionException e) {
            throw translate(request, e.getCause());
        }
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    private static RuntimeException translate(HttpRequest request, Throwable cause) {
        if (cause instanceof IOException ioException) {
            return new TransportException(request.method() + " " + request.uri().getHost()
                    + request.uri().getPath() + " failed: " + ioException, ioException);
        }
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new ApiClientException("Unexpected failure sending " + request.method() + " request", cause);
    }
}
