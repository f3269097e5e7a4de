package bigdata.clebeg.median.quickstart.state;

import bigdata.clebeg.median.core.SlidingMedian;
import bigdata.clebeg.median.core.ValueNotFoundException;
import bigdata.clebeg.median.model.MedianResult;
import bigdata.clebeg.median.model.SeriesValue;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.apache.flink.api.common.state.MapState;
import org.apache.flink.api.common.state.MapStateDescriptor;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 每个序列（key）维护一个大小为 window 的滑动窗口，窗口满了就输出一次中位数。
 * 窗口内容保存在 map state 中（插入序号 -> 值），会被 checkpoint；
 * 中位数结构只放内存，最多缓存 cacheSize 个 key（LRU），
 * 故障恢复或被淘汰后再次访问该 key 时从 map state 重建。
 *
 * @author clebeg
 */
public class SlidingMedianProcessFunction extends KeyedProcessFunction<String, SeriesValue, MedianResult> {
    private static final Logger LOG = LoggerFactory.getLogger(SlidingMedianProcessFunction.class);

    public static final int DEFAULT_CACHE_SIZE = 1024;

    private final int window;
    private final int cacheSize;

    // map state 保存窗口内的值，key 是该序列中的插入序号
    private transient MapState<Long, Double> windowState;
    // 下一个插入序号
    private transient ValueState<Long> seqState;
    private transient Map<String, SlidingMedian<Double>> trackers;

    public SlidingMedianProcessFunction(int window) {
        this(window, DEFAULT_CACHE_SIZE);
    }

    public SlidingMedianProcessFunction(int window, int cacheSize) {
        Validate.isTrue(window >= 1, "window size must be >= 1, got %d", window);
        Validate.isTrue(cacheSize >= 1, "tracker cache size must be >= 1, got %d", cacheSize);
        this.window = window;
        this.cacheSize = cacheSize;
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        windowState = getRuntimeContext().getMapState(new MapStateDescriptor<>("windowState",
                TypeInformation.of(Long.class), TypeInformation.of(Double.class)));
        seqState = getRuntimeContext().getState(new ValueStateDescriptor<>("seqState",
                TypeInformation.of(Long.class)));
        trackers = new TrackerCache<>(cacheSize);
    }

    @Override
    public void processElement(SeriesValue elem,
            KeyedProcessFunction<String, SeriesValue, MedianResult>.Context ctx,
            Collector<MedianResult> collector) throws Exception {
        String key = ctx.getCurrentKey();
        SlidingMedian<Double> tracker = trackers.get(key);
        if (tracker == null) {
            // 新 key、从 checkpoint 恢复或者已被 LRU 淘汰
            tracker = SlidingMedian.copyOf(windowState.values());
            trackers.put(key, tracker);
            if (!tracker.isEmpty()) {
                LOG.debug("Rebuilt window of key {} from state, size={}", key, tracker.size());
            }
        }

        long seq = seqState.value() == null ? 0L : seqState.value();
        windowState.put(seq, elem.getValue());
        tracker.insert(elem.getValue());

        if (seq >= window - 1) {
            collector.collect(new MedianResult(key, seq, tracker.median().doubleValue()));
            long evictSeq = seq - window + 1;
            Double evicted = windowState.get(evictSeq);
            windowState.remove(evictSeq);
            try {
                tracker.remove(evicted);
            } catch (ValueNotFoundException e) {
                LOG.error("Window of key {} lost track of value {} at seq {}", key, evicted, evictSeq, e);
                throw e;
            }
        }
        seqState.update(seq + 1);
    }
}
