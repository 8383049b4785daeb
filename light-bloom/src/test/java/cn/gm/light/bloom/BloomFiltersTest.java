package cn.gm.light.bloom;

import cn.gm.light.bloom.config.BloomConfig;
import cn.gm.light.bloom.enums.ErrorType;
import cn.gm.light.bloom.enums.LockType;
import cn.gm.light.bloom.exception.BloomException;
import cn.gm.light.bloom.hash.Murmur3HashProvider;
import cn.gm.light.bloom.hash.MurmurHash64Provider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class BloomFiltersTest {

    @Test
    public void testConfigDefaults() {
        BloomConfig config = new BloomConfig();
        Assertions.assertEquals(LockType.EXCLUSIVE, config.getLockType());
        Assertions.assertInstanceOf(Murmur3HashProvider.class, config.getHashProvider());
        Assertions.assertNull(config.getFalsePositiveGrowth());
    }

    @Test
    public void testCreate() {
        BloomConfig config = new BloomConfig();
        config.setElementCountEstimate(1000);
        config.setFalsePositiveRate(0.01);
        config.setLockType(LockType.SHARED_EXCLUSIVE);

        StandardBloomFilter filter = BloomFilters.create(config);
        Assertions.assertEquals(9586, filter.getBitCount());
        Assertions.assertEquals(LockType.SHARED_EXCLUSIVE, filter.getLockType());
        filter.add("foo");
        Assertions.assertTrue(filter.test("foo"));
    }

    @Test
    public void testCreateScalable() {
        BloomConfig config = new BloomConfig();
        config.setElementCountEstimate(100);
        config.setFalsePositiveRate(0.01);
        config.setFalsePositiveGrowth(2.0);
        config.setHashProvider(new MurmurHash64Provider());
        config.setLockType(LockType.NONE);

        ScalableBloomFilter filter = BloomFilters.createScalable(config);
        for (int i = 0; i < 1000; i++) {
            filter.add("item-" + i);
        }
        Assertions.assertTrue(filter.getLayerCount() > 1);
        Assertions.assertEquals(LockType.NONE, filter.getLockType());
        for (int i = 0; i < 1000; i++) {
            Assertions.assertTrue(filter.test("item-" + i));
        }
    }

    @Test
    public void testInvalidConfig() {
        assertError(ErrorType.INVALID_PARAMETER, () -> BloomFilters.create(null));
        assertError(ErrorType.INVALID_PARAMETER, () -> BloomFilters.createScalable(null));

        // 未设置元素数
        BloomConfig missingCount = new BloomConfig();
        missingCount.setFalsePositiveRate(0.01);
        assertError(ErrorType.INVALID_PARAMETER, () -> BloomFilters.create(missingCount));

        BloomConfig missingGrowth = new BloomConfig();
        missingGrowth.setElementCountEstimate(100);
        missingGrowth.setFalsePositiveRate(0.01);
        assertError(ErrorType.INVALID_PARAMETER, () -> BloomFilters.createScalable(missingGrowth));

        BloomConfig noLock = new BloomConfig();
        noLock.setElementCountEstimate(100);
        noLock.setFalsePositiveRate(0.01);
        noLock.setLockType(null);
        assertError(ErrorType.INVALID_LOCK_POLICY, () -> BloomFilters.create(noLock));

        BloomConfig noHash = new BloomConfig();
        noHash.setElementCountEstimate(100);
        noHash.setFalsePositiveRate(0.01);
        noHash.setHashProvider(null);
        assertError(ErrorType.INVALID_PARAMETER, () -> BloomFilters.create(noHash));
    }

    private static void assertError(ErrorType type, Runnable action) {
        BloomException e = Assertions.assertThrows(BloomException.class, action::run);
        Assertions.assertEquals(type, e.getErrorType());
    }
}
