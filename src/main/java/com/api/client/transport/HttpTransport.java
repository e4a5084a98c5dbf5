package com.api.client.transport;

import com.api.client.context.RequestContext;

import java.io.InputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Sends one HTTP request and hands back the response with its body still open.
 *
 * <p>Implementations must stop waiting promptly once the context is done and then throw
 * {@link com.api.client.exception.RequestCancelledException}. Network failures surface as
 * {@link com.api.client.exception.TransportException}.</p>
 */
@FunctionalInterface
public interface HttpTransport {

    HttpResponse<InputStream> send(HttpRequest request, RequestContext context);
}
