package org.exprengine.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * double 的文本格式化，输出与 printf 的 %g 格式一致：
 * 保留指定位数的有效数字，去掉末尾的 0，整数不带小数点，
 * 十进制指数小于 -4 或不小于精度时改用科学计数法。
 * 例如 2 -> "2"，0.5 -> "0.5"，2.0/3 -> "0.666667"，1e6 -> "1e+06"。
 */
public final class NumberFormats {

    private static final Logger logger = LoggerFactory.getLogger(NumberFormats.class);

    private NumberFormats() {
    }

    /**
     * @param value 要格式化的值。
     * @param precision 有效数字位数，至少为 1。
     * @return 格式化后的文本。
     */
    public static String format(double value, int precision) {
        if (precision < 1) {
            logger.error("有效数字位数必须至少为 1，收到 {}", precision);
            throw new IllegalArgumentException("precision 必须至少为 1: " + precision);
        }
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            // -0.0 保留符号
            return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
        }

        BigDecimal rounded = new BigDecimal(value).round(new MathContext(precision, RoundingMode.HALF_EVEN));
        int exponent = rounded.precision() - rounded.scale() - 1;

        if (exponent < -4 || exponent >= precision) {
            String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
            String sign = exponent < 0 ? "-" : "+";
            return mantissa + "e" + sign + String.format(Locale.ROOT, "%02d", Math.abs(exponent));
        }
        return rounded.stripTrailingZeros().toPlainString();
    }
}
