package hrl.java.store;

/**
 * The backing store could not serve a request: unreachable, throttled or failing.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
