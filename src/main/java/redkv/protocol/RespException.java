package redkv.protocol;

/**
 * Base class of the codec's decode failures.
 */
public class RespException extends Exception {
    public RespException(String message) {
        super(message);
    }

    protected RespException(String message, boolean writableStackTrace) {
        super(message, null, false, writableStackTrace);
    }
}
