package bigdata.clebeg.median.quickstart.parse;

import bigdata.clebeg.median.model.SeriesValue;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.apache.flink.api.common.functions.FlatMapFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 把一行文本解析成 SeriesValue：
 * 1. "3" 或 "1 3 -1" -> 序列 default
 * 2. "sensor1,3.5" -> 序列 sensor1
 * 空行直接跳过，坏数据打日志丢弃，不让任务失败。
 */
public class SeriesValueParser implements FlatMapFunction<String, SeriesValue> {
    private static final Logger LOG = LoggerFactory.getLogger(SeriesValueParser.class);
    private static final int KEYED_FIELD_NUM = 2;

    @Override
    public void flatMap(String line, Collector<SeriesValue> collector) throws Exception {
        if (StringUtils.isBlank(line)) {
            return;
        }
        if (line.contains(",")) {
            String[] split = line.split(",", -1);
            String key = StringUtils.trim(split[0]);
            String value = split.length == KEYED_FIELD_NUM ? StringUtils.trim(split[1]) : null;
            if (split.length != KEYED_FIELD_NUM || StringUtils.isEmpty(key) || !isNumber(value)) {
                LOG.warn("Bad row: {}", line);
                return;
            }
            collector.collect(new SeriesValue(key, Double.parseDouble(value)));
            return;
        }
        String[] values = StringUtils.split(line);
        for (String value : values) {
            if (!isNumber(value)) {
                // 整行丢弃，避免只收一半的值打乱窗口
                LOG.warn("Bad row: {}", line);
                return;
            }
        }
        for (String value : values) {
            collector.collect(new SeriesValue(SeriesValue.DEFAULT_KEY, Double.parseDouble(value)));
        }
    }

    private static boolean isNumber(String value) {
        return NumberUtils.isParsable(value);
    }
}
