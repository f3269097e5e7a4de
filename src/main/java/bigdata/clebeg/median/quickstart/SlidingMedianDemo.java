package bigdata.clebeg.median.quickstart;

import bigdata.clebeg.median.core.SlidingWindowMedians;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Scanner;
import java.util.stream.Collectors;
import org.apache.commons.lang3.Validate;
import org.apache.flink.api.java.utils.ParameterTool;

/**
 * 不依赖 flink 运行时的滑动窗口中位数演示。
 * 无参数：使用内置样例 [1, 3, -1, -3, 5, 3, 6, 7], k = 3
 * --stdin：从标准输入读取 n k 以及 n 个整数，例如 "8 3 1 3 -1 -3 5 3 6 7"
 */
public class SlidingMedianDemo {
    private static final List<Long> SAMPLE = Arrays.asList(1L, 3L, -1L, -3L, 5L, 3L, 6L, 7L);
    private static final int SAMPLE_WINDOW = 3;

    public static void main(String[] args) {
        ParameterTool pTool = ParameterTool.fromArgs(args);
        if (pTool.has("stdin")) {
            try (Scanner scanner = new Scanner(System.in)) {
                System.out.println(runInteractive(scanner));
            }
            return;
        }
        System.out.println("Sliding Window Median - Demo");
        System.out.println("Input: " + SAMPLE.stream().map(String::valueOf).collect(Collectors.joining(" ")));
        System.out.println("Window size k = " + SAMPLE_WINDOW);
        System.out.println("Medians: " + SlidingWindowMedians.format(SlidingWindowMedians.compute(SAMPLE, SAMPLE_WINDOW)));
    }

    static String runInteractive(Scanner scanner) {
        Validate.isTrue(scanner.hasNextInt(), "expected n");
        int n = scanner.nextInt();
        Validate.isTrue(scanner.hasNextInt(), "expected k");
        int k = scanner.nextInt();
        Validate.isTrue(n >= 0, "n must be >= 0, got %d", n);
        List<Long> values = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Validate.isTrue(scanner.hasNextLong(), "expected %d numbers, got %d", n, i);
            values.add(scanner.nextLong());
        }
        return SlidingWindowMedians.format(SlidingWindowMedians.compute(values, k));
    }
}
