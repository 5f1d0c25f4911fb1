package io.github.drompincen.polarionclient.runtime.http;

import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;

/**
 * Sends one HTTP exchange. Returns every response, whatever its status; only failures to get
 * a response are thrown.
 *
 * @see JdkHttpTransport
 */
public interface HttpTransport {

    /**
     * @throws io.github.drompincen.polarionclient.runtime.error.TransportException when no response was received
     * @throws io.github.drompincen.polarionclient.runtime.error.OperationCancelledException when the token was cancelled
     */
    TransportResponse send(TransportRequest request, CancellationToken token);
}
