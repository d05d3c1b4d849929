package redkv.protocol;

import io.netty.buffer.ByteBuf;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A map frame with text keys. Entries are kept in key order so the encoding
 * is deterministic; keys go on the wire as SimpleString frames.
 */
public final class RespMap extends Frame {
    private final SortedMap<String, Frame> entries;

    public RespMap(Map<String, ? extends Frame> entries) {
        TreeMap<String, Frame> copy = new TreeMap<>();
        for (Map.Entry<String, ? extends Frame> e : entries.entrySet()) {
            if (e.getValue() == null) throw new NullPointerException("map value for " + e.getKey());
            copy.put(checkLineText(e.getKey(), "map key"), e.getValue());
        }
        this.entries = Collections.unmodifiableSortedMap(copy);
    }

    public SortedMap<String, Frame> getEntries() {
        return entries;
    }

    public Frame get(String key) {
        return entries.get(key);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public FrameType getType() {
        return FrameType.MAP;
    }

    @Override
    public void encode(ByteBuf out) {
        writeLine(out, FrameType.MAP, entries.size());
        for (Map.Entry<String, Frame> e : entries.entrySet()) {
            writeLine(out, FrameType.SIMPLE_STRING, e.getKey());
            e.getValue().encode(out);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespMap)) return false;
        return entries.equals(((RespMap) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Map" + entries;
    }
}
