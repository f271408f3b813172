package io.syncbridge;

/**
 * Failure of a call to the external platform.
 *
 * <p>Carries the HTTP status and the verbatim response body when the platform answered;
 * both are absent for timeouts and connection failures.
 */
public class DeliveryException extends Exception {

    /** Status code used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String responseBody;

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
        this.responseBody = null;
    }

    public DeliveryException(int statusCode, String responseBody) {
        super("External platform returned HTTP " + statusCode);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }

    public boolean hasStatus() {
        return statusCode != NO_STATUS;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
