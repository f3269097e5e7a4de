package bigdata.clebeg.median.quickstart;

import bigdata.clebeg.median.model.MedianResult;
import bigdata.clebeg.median.model.SeriesValue;
import bigdata.clebeg.median.quickstart.parse.SeriesValueParser;
import bigdata.clebeg.median.quickstart.sourcce.RandomNumberSource;
import bigdata.clebeg.median.quickstart.state.SlidingMedianProcessFunction;
import org.apache.flink.api.common.restartstrategy.RestartStrategies;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * flink 实时计算滑动窗口中位数
 * 每来一个值窗口向前滑动一步，窗口满 k 个值时输出一次中位数，不同序列各自计算。
 * input（nc -lk 9999）:
 * 1
 * 3
 * -1
 * sensor1,2.5
 *
 * output:
 * median> default,2,1
 * 启动参数见 {@link MedianJobOptions}
 * flink run -c bigdata.clebeg.median.quickstart.StreamSlidingMedian flink-sliding-median-1.0-SNAPSHOT.jar --window 3 --host bigdata1
 * @author clebeg
 */
public class StreamSlidingMedian {
    private static final Logger LOG = LoggerFactory.getLogger(StreamSlidingMedian.class);

    static final String[] SAMPLE = {"1", "3", "-1", "-3", "5", "3", "6", "7"};

    public static void main(String[] args) throws Exception {
        MedianJobOptions options = MedianJobOptions.fromArgs(args);
        LOG.info("Start sliding median job, options={}", options);

        // step1. init env
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(options.getParallelism());
        env.setRestartStrategy(RestartStrategies.fixedDelayRestart(1, 10000));

        // step2. init source
        DataStream<String> lines = createSource(env, options);

        // step3. transformation
        SingleOutputStreamOperator<MedianResult> medians = buildPipeline(lines, options.getWindow(), options.getTrackerCache());

        // step4. sink
        medians.print("median");
        if (options.getOutput() != null) {
            medians.writeAsText(options.getOutput());
        }

        // step5. execute
        env.execute(StreamSlidingMedian.class.getSimpleName());
    }

    static DataStream<String> createSource(StreamExecutionEnvironment env, MedianJobOptions options) {
        switch (options.sourceType()) {
            case SOCKET:
                return env.socketTextStream(options.getHost(), options.getPort());
            case FILE:
                return env.readTextFile(options.getInput());
            case RANDOM:
                // 随机数据集中到一个分区，保证同一序列有序
                return env.addSource(new RandomNumberSource(options.getRandom(), -100, 101, 0L))
                        .setParallelism(1);
            default:
                return env.fromElements(SAMPLE);
        }
    }

    public static SingleOutputStreamOperator<MedianResult> buildPipeline(DataStream<String> lines, int window) {
        return buildPipeline(lines, window, SlidingMedianProcessFunction.DEFAULT_CACHE_SIZE);
    }

    public static SingleOutputStreamOperator<MedianResult> buildPipeline(DataStream<String> lines, int window,
            int trackerCache) {
        return lines.flatMap(new SeriesValueParser())
                .returns(SeriesValue.class)
                .keyBy(SeriesValue::getKey, Types.STRING)
                .process(new SlidingMedianProcessFunction(window, trackerCache));
    }
}
