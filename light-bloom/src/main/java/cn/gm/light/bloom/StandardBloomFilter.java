package cn.gm.light.bloom;

import cn.gm.light.bloom.entity.FilterStats;
import cn.gm.light.bloom.enums.LockType;
import cn.gm.light.bloom.exception.BloomException;
import cn.gm.light.bloom.hash.ByteHasher;
import cn.gm.light.bloom.hash.HashProvider;
import cn.gm.light.bloom.hash.Murmur3HashProvider;
import cn.gm.light.bloom.lock.FilterLock;
import cn.gm.light.bloom.lock.FilterLocks;
import cn.gm.light.bloom.utils.BloomMath;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * 单层布隆过滤器：一个定长位数组、k 个哈希函数、一把独占的锁。
 * <p>
 * m 与 k 在构造时由 (n, p) 推导，之后不再变化；位只会从 0 变为 1。
 *
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @date 2026/10/12 16:40:18
 */
@Slf4j
public class StandardBloomFilter implements BloomFilter {
    private static final int MAX_WORDS = Integer.MAX_VALUE - 8;

    private final long expectedElements;
    private final double falsePositiveRate;
    private final long bitCount;                 // 位数组总长度（单位：bit）
    private final int hashCount;                 // 哈希函数数量
    private final long[] words;                  // 每个元素管理64位
    private final List<ByteHasher> hashers;
    private final LockType lockType;
    private final FilterLock lock;
    private final LongAdder insertions = new LongAdder();

    public StandardBloomFilter(long expectedElements, double falsePositiveRate) {
        this(expectedElements, falsePositiveRate, new Murmur3HashProvider(), LockType.EXCLUSIVE);
    }

    public StandardBloomFilter(long expectedElements, double falsePositiveRate,
                               HashProvider hashProvider, LockType lockType) {
        this.bitCount = BloomMath.optimalBitCount(expectedElements, falsePositiveRate);
        this.expectedElements = expectedElements;
        this.falsePositiveRate = falsePositiveRate;
        this.hashCount = BloomMath.optimalHashCount(expectedElements, bitCount);
        long wordCount = (bitCount - 1) / 64 + 1;
        if (wordCount > MAX_WORDS) {
            throw BloomException.invalidParameter("bit count " + bitCount + " exceeds the maximum bit array size");
        }
        if (hashProvider == null) {
            throw BloomException.invalidParameter("hash provider is null");
        }
        this.lockType = lockType;
        this.lock = FilterLocks.create(lockType);
        this.hashers = resolveHashers(hashProvider, hashCount);
        this.words = new long[(int) wordCount];
        log.debug("Bloom filter created, n={}, p={}, m={}, k={}, lock={}",
                expectedElements, falsePositiveRate, bitCount, hashCount, lockType);
    }

    private static List<ByteHasher> resolveHashers(HashProvider hashProvider, int hashCount) {
        List<ByteHasher> provided;
        try {
            provided = hashProvider.getHashes(hashCount);
        } catch (BloomException e) {
            throw e;
        } catch (RuntimeException e) {
            throw BloomException.hashProviderFailure("hash provider failed to supply " + hashCount + " hash functions", e);
        }
        if (provided == null || provided.size() < hashCount) {
            throw BloomException.hashProviderFailure("hash provider supplied "
                    + (provided == null ? 0 : provided.size()) + " hash functions, " + hashCount + " required");
        }
        ImmutableList.Builder<ByteHasher> builder = ImmutableList.builderWithExpectedSize(hashCount);
        for (int i = 0; i < hashCount; i++) {
            ByteHasher hasher = provided.get(i);
            if (hasher == null) {
                throw BloomException.hashProviderFailure("hash provider supplied a null hash function at index " + i);
            }
            builder.add(hasher);
        }
        return builder.build();
    }

    @Override
    public void add(byte[] element) {
        Objects.requireNonNull(element, "element");
        lock.lockExclusive();
        try {
            for (ByteHasher hasher : hashers) {
                long bitIndex = Long.remainderUnsigned(hasher.hash(element), bitCount);
                words[(int) (bitIndex >>> 6)] |= 1L << (bitIndex & 63);
            }
        } finally {
            lock.unlockExclusive();
        }
        insertions.increment();
    }

    @Override
    public boolean test(byte[] element) {
        Objects.requireNonNull(element, "element");
        lock.lockShared();
        try {
            for (ByteHasher hasher : hashers) {
                long bitIndex = Long.remainderUnsigned(hasher.hash(element), bitCount);
                if ((words[(int) (bitIndex >>> 6)] & (1L << (bitIndex & 63))) == 0) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.unlockShared();
        }
    }

    public long cardinality() {
        lock.lockShared();
        try {
            long setBits = 0;
            for (long word : words) {
                setBits += Long.bitCount(word);
            }
            return setBits;
        } finally {
            lock.unlockShared();
        }
    }

    @Override
    public FilterStats stats() {
        long setBits = cardinality();
        long inserted = insertions.sum();
        return FilterStats.builder()
                .kind(FilterStats.KIND_STANDARD)
                .bitCount(bitCount)
                .hashCount(hashCount)
                .setBits(setBits)
                .fillRatio((double) setBits / bitCount)
                .estimatedFalsePositiveRate(BloomMath.estimatedFalsePositiveRate(setBits, bitCount, hashCount))
                .insertions(inserted)
                .layerCount(1)
                .elementCount(inserted)
                .build();
    }

    public long getExpectedElements() { return expectedElements; }

    public double getFalsePositiveRate() { return falsePositiveRate; }

    public long getBitCount() { return bitCount; }

    public int getHashCount() { return hashCount; }

    public LockType getLockType() { return lockType; }
}
