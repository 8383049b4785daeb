package cn.gm.light.bloom.utils;

import cn.gm.light.bloom.exception.BloomException;

/**
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @description 由目标元素数 n 与误判率 p 推导最优位数 m 和哈希函数个数 k
 * @date 2026/10/12 15:40:03
 */
public final class BloomMath {
    private static final double LN2 = Math.log(2);
    private static final double LN2_SQUARED = LN2 * LN2;

    private BloomMath() {
    }

    public static void checkElementCount(long n) {
        if (n <= 0) {
            throw BloomException.invalidParameter("element count estimate must be greater than 0, got " + n);
        }
    }

    public static void checkFalsePositiveRate(double p) {
        // 写成取反形式，NaN 同样被拒绝
        if (!(p > 0 && p < 1)) {
            throw BloomException.invalidParameter("false positive rate must be between 0 and 1, got " + p);
        }
    }

    public static void checkGrowthFactor(double growth) {
        if (!(growth > 0) || Double.isInfinite(growth)) {
            throw BloomException.invalidParameter("false positive growth must be a finite value greater than 0, got " + growth);
        }
    }

    /**
     * m = ceil(-n * ln(p) / (ln 2)^2)，最小为 1。
     */
    public static long optimalBitCount(long n, double p) {
        checkElementCount(n);
        checkFalsePositiveRate(p);
        double m = Math.ceil(-n * Math.log(p) / LN2_SQUARED);
        if (m >= Long.MAX_VALUE) {
            throw BloomException.invalidParameter("bit count overflows for n=" + n + ", p=" + p);
        }
        return Math.max(1L, (long) m);
    }

    /**
     * k = ceil((m / n) * ln 2)，最小为 1。
     */
    public static int optimalHashCount(long n, long m) {
        checkElementCount(n);
        double k = Math.ceil(((double) m / n) * LN2);
        return (int) Math.max(1L, (long) k);
    }

    /**
     * 按当前置位比例估算的误判率 (setBits / m)^k。
     */
    public static double estimatedFalsePositiveRate(long setBits, long bitCount, int hashCount) {
        return Math.pow((double) setBits / bitCount, hashCount);
    }
}
