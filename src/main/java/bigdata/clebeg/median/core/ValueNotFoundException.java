package bigdata.clebeg.median.core;

/**
 * remove 了一个不在窗口里的值：说明调用方的窗口记账已经出错。
 */
public class ValueNotFoundException extends MedianWindowException {

    /** 调用方尝试删除的值 */
    private final Object value;

    public ValueNotFoundException(Object value) {
        super("value not tracked by window: " + value);
        this.value = value;
    }

    public Object getValue() {
        return value;
    }
}
