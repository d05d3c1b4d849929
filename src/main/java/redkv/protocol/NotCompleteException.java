package redkv.protocol;

/**
 * Signals that the buffer does not yet hold a whole frame. Nothing was consumed;
 * the caller appends more bytes and repeats the same call.
 */
public final class NotCompleteException extends RespException {
    public static final NotCompleteException INSTANCE = new NotCompleteException();

    private NotCompleteException() {
        super("frame not complete", false);
    }
}
