package io.github.drompincen.polarionclient.runtime.http;

import io.github.drompincen.polarionclient.runtime.error.OperationCancelledException;
import io.github.drompincen.polarionclient.runtime.error.TransportException;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link HttpTransport} on {@code java.net.http}. Cancelling the token cancels the pending
 * exchange.
 */
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient client;
    private final Duration defaultTimeout;

    public JdkHttpTransport(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), requestTimeout);
    }

    public JdkHttpTransport(HttpClient client, Duration defaultTimeout) {
        this.client = client;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public TransportResponse send(TransportRequest request, CancellationToken token) {
        token.throwIfCancelled();
        HttpRequest httpRequest = toHttpRequest(request);
        CompletableFuture<HttpResponse<byte[]>> future =
                client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
            HttpResponse<byte[]> response = future.get();
            return new TransportResponse(response.statusCode(), response.headers().map(), response.body());
        } catch (CancellationException e) {
            throw new OperationCancelledException(request + " cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(request + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (token.isCancelled()) {
                throw new OperationCancelledException(request + " cancelled", cause);
            }
            throw new TransportException(request + " failed: " + cause.getMessage(), cause);
        }
    }

    private HttpRequest toHttpRequest(TransportRequest request) {
        HttpRequest.BodyPublisher publisher = request.hasBody()
                ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                : HttpRequest.BodyPublishers.noBody();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.uri())
                .method(request.method(), publisher);
        Duration timeout = request.timeout() != null ? request.timeout() : defaultTimeout;
        if (timeout != null) {
            builder.timeout(timeout);
        }
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }
}
