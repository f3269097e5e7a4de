package bigdata.clebeg.median.core;

import bigdata.clebeg.median.utils.MedianFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.apache.commons.lang3.Validate;

/**
 * 按窗口大小 k 计算整个序列每个窗口的中位数。
 * input: [1, 3, -1, -3, 5, 3, 6, 7], k = 3
 * output: [1, -1, -1, 3, 5, 6]
 */
public final class SlidingWindowMedians {

    private SlidingWindowMedians() {
    }

    public static <T extends Number & Comparable<? super T>> List<Number> compute(List<T> values, int k) {
        Objects.requireNonNull(values, "values");
        Validate.isTrue(k >= 1, "window size must be >= 1, got %d", k);
        List<Number> medians = new ArrayList<>(Math.max(values.size() - k + 1, 0));
        SlidingMedian<T> window = new SlidingMedian<>();
        for (int i = 0; i < values.size(); i++) {
            window.insert(values.get(i));
            if (i >= k - 1) {
                medians.add(window.median());
                // 移出窗口的是 k 步之前进来的值
                window.remove(values.get(i - k + 1));
            }
        }
        return medians;
    }

    public static String format(List<? extends Number> medians) {
        return medians.stream().map(MedianFormatter::format).collect(Collectors.joining(" "));
    }
}
