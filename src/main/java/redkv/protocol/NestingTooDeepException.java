package redkv.protocol;

/**
 * Aggregates nested past {@link RespGrammar#MAX_DEPTH}. Unlike other grammar
 * errors this is known before the frame is complete.
 */
final class NestingTooDeepException extends MalformedFrameException {
    NestingTooDeepException(FrameType type, int maxDepth) {
        super(type, "nesting deeper than " + maxDepth + " levels");
    }
}
