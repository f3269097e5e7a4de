package bigdata.clebeg.median.quickstart;

import static org.junit.jupiter.api.Assertions.*;

import bigdata.clebeg.median.model.MedianResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.CloseableIterator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * 在本地 flink 环境中跑完整的 pipeline。
 */
@DisplayName("StreamSlidingMedian pipeline")
class StreamSlidingMedianTest {

    private static List<MedianResult> run(int window, String... lines) throws Exception {
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(1);
        DataStream<String> source = env.fromElements(lines);
        List<MedianResult> results = new ArrayList<>();
        try (CloseableIterator<MedianResult> it = StreamSlidingMedian.buildPipeline(source, window).executeAndCollect()) {
            it.forEachRemaining(results::add);
        }
        return results;
    }

    private static List<MedianResult> ofKey(List<MedianResult> results, String key) {
        return results.stream().filter(r -> key.equals(r.getKey())).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Built-in sample yields the sliding medians")
    void sampleStream() throws Exception {
        List<MedianResult> results = run(3, StreamSlidingMedian.SAMPLE);

        assertEquals(Arrays.asList(
                new MedianResult("default", 2, 1.0d),
                new MedianResult("default", 3, -1.0d),
                new MedianResult("default", 4, -1.0d),
                new MedianResult("default", 5, 3.0d),
                new MedianResult("default", 6, 5.0d),
                new MedianResult("default", 7, 6.0d)), results);
        assertEquals("default,7,6", results.get(5).toString());
    }

    @Test
    @DisplayName("Each series keeps its own window and bad rows are skipped")
    void seriesAreIndependent() throws Exception {
        List<MedianResult> results = run(2,
                "a,1", "b,10", "oops", "a,2", "b,20", "a,4", "", "b,-20");

        assertEquals(Arrays.asList(
                new MedianResult("a", 1, 1.5d),
                new MedianResult("a", 2, 3.0d)), ofKey(results, "a"));
        assertEquals(Arrays.asList(
                new MedianResult("b", 1, 15.0d),
                new MedianResult("b", 2, 0.0d)), ofKey(results, "b"));
        assertEquals(4, results.size());
    }

    @Test
    @DisplayName("Window of one echoes the input")
    void windowOfOne() throws Exception {
        List<MedianResult> results = run(1, "5 -2 7");

        assertEquals(Arrays.asList(5.0d, -2.0d, 7.0d),
                results.stream().map(MedianResult::getMedian).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Fewer values than the window emit nothing")
    void shortStream() throws Exception {
        assertTrue(run(4, "1", "2", "3").isEmpty());
    }

    @Test
    @DisplayName("Random source feeds a bounded stream through the pipeline")
    void randomSource() throws Exception {
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(1);
        MedianJobOptions options = MedianJobOptions.fromArgs(new String[]{"--random", "20", "--window", "3"});
        DataStream<String> source = StreamSlidingMedian.createSource(env, options);

        List<MedianResult> results = new ArrayList<>();
        try (CloseableIterator<MedianResult> it = StreamSlidingMedian.buildPipeline(source, 3).executeAndCollect()) {
            it.forEachRemaining(results::add);
        }

        assertEquals(18, results.size());
        for (MedianResult result : results) {
            assertTrue(result.getMedian() >= -100 && result.getMedian() <= 100, "median out of range: " + result);
        }
    }

    @Test
    @DisplayName("Many interleaved series stay correct with a tiny tracker cache")
    void manySeriesWithSmallCache() throws Exception {
        int keys = 50;
        List<String> lines = new ArrayList<>();
        for (int j = 0; j < 4; j++) {
            for (int i = 0; i < keys; i++) {
                lines.add("k" + i + "," + (i * 10 + j));
            }
        }
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(1);
        DataStream<String> source = env.fromCollection(lines);

        List<MedianResult> results = new ArrayList<>();
        try (CloseableIterator<MedianResult> it = StreamSlidingMedian.buildPipeline(source, 3, 2).executeAndCollect()) {
            it.forEachRemaining(results::add);
        }

        assertEquals(keys * 2, results.size());
        for (int i = 0; i < keys; i++) {
            assertEquals(Arrays.asList(
                    new MedianResult("k" + i, 2, i * 10 + 1.0d),
                    new MedianResult("k" + i, 3, i * 10 + 2.0d)), ofKey(results, "k" + i));
        }
    }
}
