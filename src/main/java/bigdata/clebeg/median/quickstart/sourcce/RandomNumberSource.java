package bigdata.clebeg.median.quickstart.sourcce;

import org.apache.commons.lang3.RandomUtils;
import org.apache.commons.lang3.Validate;
import org.apache.flink.streaming.api.functions.source.RichParallelSourceFunction;

/**
 * 自定义数据源-随机生成数字，每行一个整数，取值 [min, max)
 *
 * @author clebeg
 **/
public class RandomNumberSource extends RichParallelSourceFunction<String> {
    private final long count;
    private final int min;
    private final int max;
    private final long intervalMs;
    private volatile boolean flag = true;

    public RandomNumberSource(long count, int min, int max, long intervalMs) {
        Validate.isTrue(count >= 0, "count must be >= 0");
        Validate.isTrue(min < max, "min must be < max");
        Validate.isTrue(intervalMs >= 0, "interval must be >= 0");
        this.count = count;
        this.min = min;
        this.max = max;
        this.intervalMs = intervalMs;
    }

    @Override
    public void run(SourceContext<String> ctx) throws Exception {
        long emitted = 0;
        while (flag && emitted < count) {
            // RandomUtils 只支持非负区间，先平移
            int value = min + RandomUtils.nextInt(0, max - min);
            synchronized (ctx.getCheckpointLock()) {
                ctx.collect(String.valueOf(value));
            }
            emitted++;
            if (intervalMs > 0) {
                Thread.sleep(intervalMs);
            }
        }
    }

    @Override
    public void cancel() {
        flag = false;
    }
}
