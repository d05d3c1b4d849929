package redkv.protocol;

import io.netty.buffer.ByteBuf;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of frames. A null item list is the null array
 * ({@code *-1}), which is distinct from the empty one ({@code *0}).
 */
public final class RespArray extends Frame {
    public static final RespArray NULL = new RespArray(null);
    public static final RespArray EMPTY = new RespArray(Collections.<Frame>emptyList());

    private final List<Frame> items;

    public RespArray(List<? extends Frame> items) {
        this.items = items == null ? null : Collections.unmodifiableList(copyItems(items));
    }

    // copy that rejects null items
    static List<Frame> copyItems(List<? extends Frame> items) {
        List<Frame> copy = new ArrayList<>(items.size());
        for (Frame item : items) {
            if (item == null) throw new NullPointerException("item " + copy.size() + " must not be null");
            copy.add(item);
        }
        return copy;
    }

    public static RespArray of(Frame... items) {
        return new RespArray(Arrays.asList(items));
    }

    public boolean isNull() {
        return items == null;
    }

    /** The items; null for the null array. */
    public List<Frame> getItems() {
        return items;
    }

    public int size() {
        return items == null ? 0 : items.size();
    }

    public Frame get(int index) {
        return items.get(index);
    }

    @Override
    public FrameType getType() {
        return FrameType.ARRAY;
    }

    @Override
    public void encode(ByteBuf out) {
        if (items == null) {
            writeLine(out, FrameType.ARRAY, -1);
            return;
        }
        writeLine(out, FrameType.ARRAY, items.size());
        for (Frame item : items) {
            item.encode(out);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespArray)) return false;
        return Objects.equals(items, ((RespArray) o).items);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(items);
    }

    @Override
    public String toString() {
        return "Array" + (items == null ? "(null)" : items.toString());
    }
}
