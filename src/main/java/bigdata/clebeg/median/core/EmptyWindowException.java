package bigdata.clebeg.median.core;

/**
 * 空窗口没有中位数，不返回 0 这样的哨兵值。
 */
public class EmptyWindowException extends MedianWindowException {

    public EmptyWindowException() {
        super("median of an empty window is undefined");
    }
}
