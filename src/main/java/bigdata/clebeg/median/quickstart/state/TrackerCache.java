package bigdata.clebeg.median.quickstart.state;

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * 按访问顺序淘汰的 LRU 缓存，容量满了丢掉最久没访问的 key。
 * 被淘汰的中位数结构下次访问时从 map state 重建，所以丢掉是安全的。
 */
public class TrackerCache<K, V> extends LinkedHashMap<K, V> {
    private static final long serialVersionUID = 1L;

    private final int capacity;

    public TrackerCache(int capacity) {
        super(16, 0.75f, true);
        Validate.isTrue(capacity >= 1, "cache capacity must be >= 1, got %d", capacity);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
        return size() > capacity;
    }
}
