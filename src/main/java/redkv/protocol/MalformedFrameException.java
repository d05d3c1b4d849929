package redkv.protocol;

/**
 * The bytes violate the RESP grammar. Not retryable.
 */
public class MalformedFrameException extends RespException {
    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(FrameType type, String reason) {
        super("invalid " + (type == null ? "frame" : type.name().toLowerCase()) + ": " + reason);
    }
}
