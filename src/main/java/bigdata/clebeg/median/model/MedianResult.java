package bigdata.clebeg.median.model;

import bigdata.clebeg.median.utils.MedianFormatter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一个完整窗口的输出。windowEnd 是窗口最后一个值在该序列中的下标（从 0 开始）。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class MedianResult {
    private String key;
    private long windowEnd;
    private double median;

    @Override
    public String toString() {
        return key + "," + windowEnd + "," + MedianFormatter.format(median);
    }
}
