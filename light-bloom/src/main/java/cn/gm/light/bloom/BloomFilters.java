package cn.gm.light.bloom;

import cn.gm.light.bloom.config.BloomConfig;
import cn.gm.light.bloom.exception.BloomException;

/**
 * 按 {@link BloomConfig} 创建过滤器。
 */
public final class BloomFilters {
    private BloomFilters() {
    }

    public static StandardBloomFilter create(BloomConfig config) {
        if (config == null) {
            throw BloomException.invalidParameter("config is null");
        }
        return new StandardBloomFilter(config.getElementCountEstimate(), config.getFalsePositiveRate(),
                config.getHashProvider(), config.getLockType());
    }

    public static ScalableBloomFilter createScalable(BloomConfig config) {
        if (config == null) {
            throw BloomException.invalidParameter("config is null");
        }
        if (config.getFalsePositiveGrowth() == null) {
            throw BloomException.invalidParameter("false positive growth is required for a scalable filter");
        }
        return new ScalableBloomFilter(config.getElementCountEstimate(), config.getFalsePositiveRate(),
                config.getFalsePositiveGrowth(), config.getHashProvider(), config.getLockType());
    }
}
