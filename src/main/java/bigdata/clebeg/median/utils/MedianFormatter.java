package bigdata.clebeg.median.utils;

import cn.hutool.core.util.NumberUtil;
import java.math.BigDecimal;

/**
 * 整数中位数不带小数部分输出 (1.0 -> 1)，半数输出精确值 (2.5)。
 * 浮点数先转 BigDecimal，避免 1e7 以上的值被 Double.toString 输出成科学计数法。
 */
public final class MedianFormatter {

    private MedianFormatter() {
    }

    public static String format(Number median) {
        // -0.0 + 0.0 == 0.0，避免输出 -0
        if (median instanceof Double) {
            return NumberUtil.toStr(BigDecimal.valueOf(median.doubleValue() + 0.0d));
        }
        if (median instanceof Float) {
            return NumberUtil.toStr(new BigDecimal(Float.toString(median.floatValue() + 0.0f)));
        }
        return NumberUtil.toStr(median);
    }
}
