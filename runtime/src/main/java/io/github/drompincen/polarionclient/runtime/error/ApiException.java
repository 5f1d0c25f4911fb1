package io.github.drompincen.polarionclient.runtime.error;

import io.github.drompincen.polarionclient.protocol.api.ErrorDetail;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Non-2xx response from the server. Carries the parsed JSON:API error entries when the body
 * had them, otherwise the raw body only.
 */
public class ApiException extends PolarionException {

    private static final int MAX_RAW_BODY_IN_MESSAGE = 1000;

    private final int statusCode;
    private final List<ErrorDetail> details;
    private final String rawBody;
    private final String method;
    private final URI uri;

    public ApiException(int statusCode, String message, List<ErrorDetail> details,
                        String rawBody, String method, URI uri) {
        super(message);
        this.statusCode = statusCode;
        this.details = details == null ? List.of() : List.copyOf(details);
        this.rawBody = rawBody;
        this.method = method;
        this.uri = uri;
    }

    public int statusCode() {
        return statusCode;
    }

    public List<ErrorDetail> details() {
        return details;
    }

    public String rawBody() {
        return rawBody;
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("HTTP ").append(statusCode);
        if (method != null && uri != null) {
            sb.append(" (").append(method).append(' ').append(uri).append(')');
        }
        String message = super.getMessage();
        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }
        if (!details.isEmpty()) {
            sb.append(" [");
            for (int i = 0; i < details.size(); i++) {
                if (i > 0) {
                    sb.append("; ");
                }
                sb.append(details.get(i).describe());
            }
            sb.append(']');
        }
        return sb.toString();
    }

    /**
     * Message plus the raw response body when the body is short enough to be useful.
     */
    public String detailedMessage() {
        String base = getMessage();
        if (rawBody != null && !rawBody.isEmpty() && rawBody.length() < MAX_RAW_BODY_IN_MESSAGE) {
            return base + "\nResponse body: " + rawBody;
        }
        return base;
    }

    public static Optional<ApiException> find(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ApiException api) {
                return Optional.of(api);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    public static boolean isNotFound(Throwable error) {
        return find(error).map(api -> api.isNotFound()).orElse(false);
    }
}
