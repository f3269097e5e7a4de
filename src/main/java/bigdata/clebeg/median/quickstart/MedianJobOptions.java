package bigdata.clebeg.median.quickstart;

import lombok.Data;
import lombok.NoArgsConstructor;
import bigdata.clebeg.median.quickstart.state.SlidingMedianProcessFunction;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.apache.flink.api.java.utils.ParameterTool;

/**
 * 滑动中位数任务的启动参数：
 * --window 3 --host bigdata1 --port 9999 --input datasets/input_dir --random 100 --output xxx --parallelism 1
 * --tracker-cache 1024：每个子任务内存中最多缓存多少个序列的中位数结构
 */
@Data
@NoArgsConstructor
public class MedianJobOptions {
    public static final int DEFAULT_WINDOW = 3;
    public static final int DEFAULT_PORT = 9999;
    public static final int DEFAULT_PARALLELISM = 1;

    public enum SourceType {
        SOCKET, FILE, RANDOM, SAMPLE
    }

    private int window = DEFAULT_WINDOW;
    private String host;
    private int port = DEFAULT_PORT;
    private String input;
    private int random;
    private String output;
    private int parallelism = DEFAULT_PARALLELISM;
    private int trackerCache = SlidingMedianProcessFunction.DEFAULT_CACHE_SIZE;

    public static MedianJobOptions fromArgs(String[] args) {
        ParameterTool pTool = ParameterTool.fromArgs(args);
        MedianJobOptions options = new MedianJobOptions();
        options.setWindow(pTool.getInt("window", DEFAULT_WINDOW));
        options.setHost(pTool.get("host"));
        options.setPort(pTool.getInt("port", DEFAULT_PORT));
        options.setInput(pTool.get("input"));
        options.setRandom(pTool.getInt("random", 0));
        options.setOutput(pTool.get("output"));
        options.setParallelism(pTool.getInt("parallelism", DEFAULT_PARALLELISM));
        options.setTrackerCache(pTool.getInt("tracker-cache", SlidingMedianProcessFunction.DEFAULT_CACHE_SIZE));
        options.validate();
        return options;
    }

    public void validate() {
        Validate.isTrue(window >= 1, "--window must be >= 1, got %d", window);
        Validate.inclusiveBetween(1, 65535, port, "--port out of range: " + port);
        Validate.isTrue(random >= 0, "--random must be >= 0, got %d", random);
        Validate.isTrue(parallelism >= 1, "--parallelism must be >= 1, got %d", parallelism);
        Validate.isTrue(trackerCache >= 1, "--tracker-cache must be >= 1, got %d", trackerCache);
    }

    /** socket > file > random > 内置样例 */
    public SourceType sourceType() {
        if (StringUtils.isNotBlank(host)) {
            return SourceType.SOCKET;
        }
        if (StringUtils.isNotBlank(input)) {
            return SourceType.FILE;
        }
        if (random > 0) {
            return SourceType.RANDOM;
        }
        return SourceType.SAMPLE;
    }
}
