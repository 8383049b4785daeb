package cn.gm.light.bloom.benchmark;

import cn.gm.light.bloom.BloomFilter;
import cn.gm.light.bloom.ScalableBloomFilter;
import cn.gm.light.bloom.StandardBloomFilter;
import cn.gm.light.bloom.enums.LockType;
import cn.gm.light.bloom.hash.Murmur3HashProvider;
import lombok.extern.slf4j.Slf4j;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)          // 测试吞吐量（ops/ms）
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 3, time = 5)
@Measurement(iterations = 5, time = 10)
@Threads(8)                             // 8线程模拟并发读写
@Fork(1)
@State(Scope.Benchmark)
@Slf4j
public class BloomFilterBenchmark {

    // EXCLUSIVE 与 SHARED_EXCLUSIVE 对比读多场景
    @Param({"EXCLUSIVE", "SHARED_EXCLUSIVE"})
    private String lockType;

    private BloomFilter standardFilter;
    private BloomFilter scalableFilter;

    // 预生成已存在的key
    private byte[][] existingKeys;

    @Setup(Level.Trial)
    public void setup() {
        LockType type = LockType.of(lockType);
        int dataSize = 1_000_000;
        standardFilter = new StandardBloomFilter(dataSize, 0.01, new Murmur3HashProvider(), type);
        scalableFilter = new ScalableBloomFilter(dataSize / 10, 0.01, 2, new Murmur3HashProvider(), type);
        existingKeys = new byte[dataSize][];
        for (int i = 0; i < dataSize; i++) {
            existingKeys[i] = ("key_" + i).getBytes(StandardCharsets.UTF_8);
            standardFilter.add(existingKeys[i]);
            scalableFilter.add(existingKeys[i]);
        }
        log.info("Benchmark setup done, lock={}, scalable layers={}", type, scalableFilter.stats().getLayerCount());
    }

    private byte[] randomExistingKey() {
        return existingKeys[ThreadLocalRandom.current().nextInt(existingKeys.length)];
    }

    @Benchmark
    public void addThroughput(Blackhole blackhole) {
        byte[] key = randomExistingKey();
        standardFilter.add(key);
        blackhole.consume(key);
    }

    @Benchmark
    public void testHit(Blackhole blackhole) {
        blackhole.consume(standardFilter.test(randomExistingKey()));
    }

    @Benchmark
    public void testMiss(Blackhole blackhole) {
        byte[] key = ("miss_" + ThreadLocalRandom.current().nextLong()).getBytes(StandardCharsets.UTF_8);
        blackhole.consume(standardFilter.test(key));
    }

    // 预填充后已扩容为多层，命中检查落在最老的层
    @Benchmark
    public void scalableTestHit(Blackhole blackhole) {
        blackhole.consume(scalableFilter.test(randomExistingKey()));
    }

    @Benchmark
    public void scalableTestMiss(Blackhole blackhole) {
        byte[] key = ("miss_" + ThreadLocalRandom.current().nextLong()).getBytes(StandardCharsets.UTF_8);
        blackhole.consume(scalableFilter.test(key));
    }
}
