package bigdata.clebeg.median.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.TreeMap;

/**
 * 有序多重集合：允许重复元素，按值有序。
 * 底层用 TreeMap 保存 value -> 出现次数；size、最小值、最大值单独维护，读取都是 O(1)。
 *
 * @author clebeg
 */
public class SortedBag<T extends Comparable<? super T>> {
    private final TreeMap<T, Integer> counts;
    private int size;
    // 为空时都是 null
    private T min;
    private T max;

    public SortedBag() {
        this.counts = new TreeMap<>();
        this.size = 0;
    }

    public void add(T value) {
        if (value == null) {
            throw new NullPointerException("SortedBag does not accept null");
        }
        this.counts.merge(value, 1, Integer::sum);
        this.size += 1;
        if (this.min == null || value.compareTo(this.min) < 0) {
            this.min = value;
        }
        if (this.max == null || value.compareTo(this.max) > 0) {
            this.max = value;
        }
    }

    /**
     * 删除一个出现，而不是全部。
     *
     * @param value 要删除的值
     * @return 值不存在时返回 false，集合不变
     */
    public boolean removeOne(T value) {
        if (value == null) {
            return false;
        }
        Integer cnt = this.counts.get(value);
        if (cnt == null) {
            return false;
        }
        if (cnt == 1) {
            this.counts.remove(value);
            // 最后一个最值被删掉时才回到 TreeMap 重新取
            if (this.counts.isEmpty()) {
                this.min = null;
                this.max = null;
            } else if (value.compareTo(this.min) == 0) {
                this.min = this.counts.firstKey();
            } else if (value.compareTo(this.max) == 0) {
                this.max = this.counts.lastKey();
            }
        } else {
            this.counts.put(value, cnt - 1);
        }
        this.size -= 1;
        return true;
    }

    public T first() {
        if (this.min == null) {
            throw new NoSuchElementException("bag is empty");
        }
        return this.min;
    }

    public T last() {
        if (this.max == null) {
            throw new NoSuchElementException("bag is empty");
        }
        return this.max;
    }

    public T pollFirst() {
        T min = first();
        removeOne(min);
        return min;
    }

    public T pollLast() {
        T max = last();
        removeOne(max);
        return max;
    }

    public boolean contains(T value) {
        return value != null && this.counts.containsKey(value);
    }

    public int count(T value) {
        if (value == null) {
            return 0;
        }
        return this.counts.getOrDefault(value, 0);
    }

    public int size() {
        return this.size;
    }

    public boolean isEmpty() {
        return this.size == 0;
    }

    public void clear() {
        this.counts.clear();
        this.size = 0;
        this.min = null;
        this.max = null;
    }

    /** 升序展开，重复元素按次数重复出现 */
    public List<T> toList() {
        List<T> res = new ArrayList<>(this.size);
        for (Map.Entry<T, Integer> entry : this.counts.entrySet()) {
            res.addAll(Collections.nCopies(entry.getValue(), entry.getKey()));
        }
        return res;
    }

    @Override
    public String toString() {
        return "SortedBag" + toList();
    }
}
