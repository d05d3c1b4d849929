package redkv.db;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import redkv.protocol.Frame;
import redkv.protocol.RespArray;
import redkv.protocol.RespNull;

/**
 * The shared in-memory store: one table each for strings, hashes and sets.
 * <p>
 * Every table is a {@link ConcurrentHashMap}, so operations on different keys
 * never contend. Writes that create or update a key run inside
 * {@code compute}, which holds that key's bin lock, so writers to the same key
 * serialize and the last one to finish wins. Entries live until the process ends.
 */
public class Backend {
    private final ConcurrentHashMap<String, Frame> map = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Frame>> hmap = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> sets = new ConcurrentHashMap<>();

    public Frame get(String key) {
        return map.get(key);
    }

    public void set(String key, Frame value) {
        map.put(key, value);
    }

    public Frame hget(String key, String field) {
        ConcurrentHashMap<String, Frame> fields = hmap.get(key);
        return fields == null ? null : fields.get(field);
    }

    public void hset(String key, String field, Frame value) {
        hmap.compute(key, (k, fields) -> {
            if (fields == null) {
                fields = new ConcurrentHashMap<>();
            }
            fields.put(field, value);
            return fields;
        });
    }

    /** One reply per field, {@link RespNull} where the field (or the key) is missing. */
    public RespArray hmget(String key, List<String> fields) {
        ConcurrentHashMap<String, Frame> hash = hmap.get(key);
        List<Frame> ret = new ArrayList<>(fields.size());
        for (String field : fields) {
            Frame value = hash == null ? null : hash.get(field);
            ret.add(value == null ? RespNull.INSTANCE : value);
        }
        return new RespArray(ret);
    }

    /**
     * Copies all fields of a hash while holding the key's lock, so the copy
     * never shows half of a concurrent write. Returns null for an absent key.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Frame> hgetAll(String key) {
        final Map<String, Frame>[] snapshot = new Map[1];
        hmap.computeIfPresent(key, (k, fields) -> {
            snapshot[0] = new HashMap<>(fields);
            return fields;
        });
        return snapshot[0];
    }

    /** Returns true if the member was not present before. */
    public boolean sadd(String key, String member) {
        final boolean[] added = {false};
        sets.compute(key, (k, members) -> {
            if (members == null) {
                members = ConcurrentHashMap.newKeySet();
            }
            added[0] = members.add(member);
            return members;
        });
        return added[0];
    }

    public boolean sismember(String key, String member) {
        Set<String> members = sets.get(key);
        return members != null && members.contains(member);
    }

    /** Number of keys across all three tables. */
    public int size() {
        return map.size() + hmap.size() + sets.size();
    }

    public void clear() {
        map.clear();
        hmap.clear();
        sets.clear();
    }
}
