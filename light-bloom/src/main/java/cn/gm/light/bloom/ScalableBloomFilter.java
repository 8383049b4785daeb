package cn.gm.light.bloom;

import cn.gm.light.bloom.entity.FilterStats;
import cn.gm.light.bloom.enums.LockType;
import cn.gm.light.bloom.exception.BloomException;
import cn.gm.light.bloom.hash.HashProvider;
import cn.gm.light.bloom.hash.Murmur3HashProvider;
import cn.gm.light.bloom.utils.BloomMath;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 可扩容布隆过滤器，由若干层 {@link StandardBloomFilter} 组成，只追加不删除。
 * <p>
 * add 写入当前所有层，因此任意一层命中即可作为存在的依据；test 从最老的层开始依次检查，
 * 命中即返回。第 i 层（从 0 开始）的误判率为 {@code min(p0 * r^i, max(p0, 0.5))}，
 * 上限保证任意层数下都能构造出新层。
 * <p>
 * 最新一层的容量取 {@code m_last * ln(r) / ln 2} 与该层设计元素数的 2 倍中的较大者，
 * 累计添加次数超过容量时追加新层，新层按 n = 当前添加次数 推导参数。
 * r 越大新层出现得越晚；r 较小时按 2 倍设计容量翻倍扩容，层数随元素数对数增长。
 * <p>
 * 层之间没有整体锁：与 add 并发的 test 可能看到元素只写入了部分层。
 * 层列表整体替换，并发 test 只会看到追加前或追加后的完整列表。
 *
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @date 2026/10/13 10:05:27
 */
@Slf4j
public class ScalableBloomFilter implements BloomFilter {
    private static final double LN2 = Math.log(2);
    // 新层误判率上限，p0 更大时以 p0 为准
    private static final double MAX_LAYER_RATE = 0.5;
    // 容量下限为该层设计元素数的倍数
    private static final int MIN_CAPACITY_FACTOR = 2;

    private final double falsePositiveRate;
    private final double falsePositiveGrowth;
    private final double capacityScale;
    private final double maxLayerRate;
    private final HashProvider hashProvider;
    private final LockType lockType;
    private final AtomicLong elementCount = new AtomicLong(0);
    // 串行化扩容，避免并发越过阈值时重复追加
    private final ReentrantLock growthLock = new ReentrantLock();
    private volatile ImmutableList<StandardBloomFilter> layers;

    public ScalableBloomFilter(long initialSize, double falsePositiveRate, double falsePositiveGrowth) {
        this(initialSize, falsePositiveRate, falsePositiveGrowth, new Murmur3HashProvider(), LockType.EXCLUSIVE);
    }

    public ScalableBloomFilter(long initialSize, double falsePositiveRate, double falsePositiveGrowth,
                               HashProvider hashProvider, LockType lockType) {
        BloomMath.checkElementCount(initialSize);
        BloomMath.checkFalsePositiveRate(falsePositiveRate);
        BloomMath.checkGrowthFactor(falsePositiveGrowth);
        this.falsePositiveRate = falsePositiveRate;
        this.falsePositiveGrowth = falsePositiveGrowth;
        this.capacityScale = Math.log(falsePositiveGrowth) / LN2;
        this.maxLayerRate = Math.max(falsePositiveRate, MAX_LAYER_RATE);
        this.hashProvider = hashProvider;
        this.lockType = lockType;
        this.layers = ImmutableList.of(new StandardBloomFilter(initialSize, falsePositiveRate, hashProvider, lockType));
        if (falsePositiveGrowth <= 1) {
            log.warn("False positive growth {} is not greater than 1, layers grow at {} times their designed size",
                    falsePositiveGrowth, MIN_CAPACITY_FACTOR);
        }
    }

    /**
     * 写入所有已有层后计数，再检查是否需要追加新层。
     * 追加失败时异常直接抛给调用方，此时元素已写入所有已有层并已计数。
     */
    @Override
    public void add(byte[] element) {
        Objects.requireNonNull(element, "element");
        List<StandardBloomFilter> snapshot = layers;
        for (StandardBloomFilter layer : snapshot) {
            layer.add(element);
        }
        long n = elementCount.incrementAndGet();
        if (n > capacityOf(snapshot.get(snapshot.size() - 1))) {
            grow();
        }
    }

    private double capacityOf(StandardBloomFilter layer) {
        return Math.max(layer.getBitCount() * capacityScale,
                (double) layer.getExpectedElements() * MIN_CAPACITY_FACTOR);
    }

    double layerRate(int layerIndex) {
        return Math.min(falsePositiveRate * Math.pow(falsePositiveGrowth, layerIndex), maxLayerRate);
    }

    private void grow() {
        growthLock.lock();
        try {
            ImmutableList<StandardBloomFilter> current = layers;
            long n = elementCount.get();
            if (n <= capacityOf(current.get(current.size() - 1))) {
                // 其他线程已经追加过
                return;
            }
            int layerIndex = current.size();
            double layerRate = layerRate(layerIndex);
            StandardBloomFilter layer;
            try {
                layer = new StandardBloomFilter(n, layerRate, hashProvider, lockType);
            } catch (BloomException e) {
                log.error("Failed to append layer {}, n={}, p={}", layerIndex, n, layerRate, e);
                throw e;
            }
            layers = ImmutableList.<StandardBloomFilter>builderWithExpectedSize(layerIndex + 1)
                    .addAll(current)
                    .add(layer)
                    .build();
            log.info("Appended layer {}, n={}, p={}, m={}, k={}",
                    layerIndex, n, layerRate, layer.getBitCount(), layer.getHashCount());
        } finally {
            growthLock.unlock();
        }
    }

    @Override
    public boolean test(byte[] element) {
        Objects.requireNonNull(element, "element");
        for (StandardBloomFilter layer : layers) {
            if (layer.test(element)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public FilterStats stats() {
        List<StandardBloomFilter> snapshot = layers;
        List<FilterStats> layerStats = new ArrayList<>(snapshot.size());
        long bitCount = 0;
        long setBits = 0;
        // 任一层误判即整体误判
        double passAll = 1.0;
        for (StandardBloomFilter layer : snapshot) {
            FilterStats stats = layer.stats();
            layerStats.add(stats);
            bitCount += stats.getBitCount();
            setBits += stats.getSetBits();
            passAll *= 1.0 - stats.getEstimatedFalsePositiveRate();
        }
        long n = elementCount.get();
        return FilterStats.builder()
                .kind(FilterStats.KIND_SCALABLE)
                .bitCount(bitCount)
                .setBits(setBits)
                .fillRatio((double) setBits / bitCount)
                .estimatedFalsePositiveRate(1.0 - passAll)
                .insertions(n)
                .layerCount(snapshot.size())
                .elementCount(n)
                .layers(layerStats)
                .build();
    }

    public int getLayerCount() { return layers.size(); }

    public long getElementCount() { return elementCount.get(); }

    public double getFalsePositiveRate() { return falsePositiveRate; }

    public double getFalsePositiveGrowth() { return falsePositiveGrowth; }

    public LockType getLockType() { return lockType; }

    List<StandardBloomFilter> getLayers() { return layers; }
}
