package bigdata.clebeg.median.core;

/**
 * 滑动窗口中位数：用两个有序多重集合维护窗口内的数据。
 * low 保存较小的一半（取最大值），high 保存较大的一半（取最小值）。
 * 始终保证：
 * 1. low 中任意元素 <= high 中任意元素
 * 2. |low| == |high| 或 |low| == |high| + 1
 *
 * 例如，窗口 [1, 3, -1]：low = {-1, 1}, high = {3}，中位数为 1；
 * 窗口 [2, 3]：low = {2}, high = {3}，中位数为 (2 + 3) / 2 = 2.5
 *
 * 单线程使用，不做任何同步。
 *
 * @author clebeg
 */
public class SlidingMedian<T extends Number & Comparable<? super T>> {
    private final SortedBag<T> low;
    private final SortedBag<T> high;

    public SlidingMedian() {
        this.low = new SortedBag<>();
        this.high = new SortedBag<>();
    }

    /**
     * 用已知的窗口内容重建，流任务从 state 恢复时使用。
     */
    public static <T extends Number & Comparable<? super T>> SlidingMedian<T> copyOf(Iterable<T> values) {
        SlidingMedian<T> median = new SlidingMedian<>();
        for (T value : values) {
            median.insert(value);
        }
        return median;
    }

    public void insert(T x) {
        if (x == null) {
            throw new NullPointerException("cannot insert null into window");
        }
        // 等于 low 最大值的也放 low，重复值不会把 high 撑大
        if (this.low.isEmpty() || x.compareTo(this.low.last()) <= 0) {
            this.low.add(x);
        } else {
            this.high.add(x);
        }
        rebalance();
    }

    /**
     * 删除窗口中的一个 x，先找 low 再找 high。
     *
     * @throws ValueNotFoundException x 不在窗口中，窗口保持不变
     */
    public void remove(T x) {
        if (!this.low.removeOne(x) && !this.high.removeOne(x)) {
            throw new ValueNotFoundException(x);
        }
        rebalance();
    }

    /**
     * 奇数个元素直接返回 low 的最大值，类型与存入的值一致；
     * 偶数个元素返回两中间值的平均，用 double 计算避免 long 溢出。
     * 两边的最值都已缓存，读取是 O(1)。
     *
     * @throws EmptyWindowException 窗口为空
     */
    public Number median() {
        if (this.low.isEmpty()) {
            throw new EmptyWindowException();
        }
        if (this.low.size() > this.high.size()) {
            return this.low.last();
        }
        double a = this.low.last().doubleValue();
        double b = this.high.first().doubleValue();
        // 先除再加，double 极值也不会溢出
        return a / 2 + b / 2;
    }

    public int size() {
        return this.low.size() + this.high.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void clear() {
        this.low.clear();
        this.high.clear();
    }

    int lowSize() {
        return this.low.size();
    }

    int highSize() {
        return this.high.size();
    }

    SortedBag<T> low() {
        return this.low;
    }

    SortedBag<T> high() {
        return this.high;
    }

    // 每次 insert/remove 后最多移动一次，这里仍然循环到稳定
    private void rebalance() {
        while (this.low.size() > this.high.size() + 1) {
            this.high.add(this.low.pollLast());
        }
        while (this.low.size() < this.high.size()) {
            this.low.add(this.high.pollFirst());
        }
    }

    @Override
    public String toString() {
        return "SlidingMedian(low=" + this.low.toList() + ", high=" + this.high.toList() + ")";
    }
}
