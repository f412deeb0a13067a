package alertcore.notify;

/**
 * 投递异常，transient为true时可以重试
 */
public class DeliveryException extends RuntimeException {
    private final boolean transientFailure;
    private final int statusCode;

    public DeliveryException(String message, boolean transientFailure, int statusCode) {
        super(message);
        this.transientFailure = transientFailure;
        this.statusCode = statusCode;
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.transientFailure = true;
        this.statusCode = 0;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
