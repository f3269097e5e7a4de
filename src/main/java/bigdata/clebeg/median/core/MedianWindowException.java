package bigdata.clebeg.median.core;

/**
 * {@link SlidingMedian} 使用错误的基类，不可重试：调用方对窗口的记账已经出错。
 */
public class MedianWindowException extends RuntimeException {

    public MedianWindowException(String message) {
        super(message);
    }
}
