package redkv.protocol;

import io.netty.buffer.ByteBuf;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A set frame. Items keep their wire order; uniqueness is the sender's concern.
 */
public final class RespSet extends Frame {
    private final List<Frame> items;

    public RespSet(List<? extends Frame> items) {
        this.items = Collections.unmodifiableList(RespArray.copyItems(items));
    }

    public static RespSet of(Frame... items) {
        return new RespSet(Arrays.asList(items));
    }

    public List<Frame> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    @Override
    public FrameType getType() {
        return FrameType.SET;
    }

    @Override
    public void encode(ByteBuf out) {
        writeLine(out, FrameType.SET, items.size());
        for (Frame item : items) {
            item.encode(out);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespSet)) return false;
        return items.equals(((RespSet) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "Set" + items;
    }
}
