package cn.gm.light.bloom.hash;

import java.util.ArrayList;
import java.util.List;

/**
 * 不依赖 Guava 的备选哈希族，MurmurHash64A 实现，小端读取。
 * 种子按黄金分割常数打散，避免相邻下标只差低位。
 */
public class MurmurHash64Provider implements HashProvider {
    private static final long M = 0xc6a4a7935bd1e995L;
    private static final int R = 47;
    private static final long SEED_STEP = 0x9e3779b97f4a7c15L;
    private static final long BASE_SEED = 0x9747b28cL;

    @Override
    public List<ByteHasher> getHashes(int count) {
        List<ByteHasher> hashers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            long seed = BASE_SEED + i * SEED_STEP;
            hashers.add(data -> murmurHash64(data, seed));
        }
        return hashers;
    }

    static long murmurHash64(byte[] data, long seed) {
        int length = data.length;
        long h = seed ^ (length * M);

        int blockEnd = length & ~7;
        for (int i = 0; i < blockEnd; i += 8) {
            long k = ((long) data[i] & 0xff)
                    | (((long) data[i + 1] & 0xff) << 8)
                    | (((long) data[i + 2] & 0xff) << 16)
                    | (((long) data[i + 3] & 0xff) << 24)
                    | (((long) data[i + 4] & 0xff) << 32)
                    | (((long) data[i + 5] & 0xff) << 40)
                    | (((long) data[i + 6] & 0xff) << 48)
                    | (((long) data[i + 7] & 0xff) << 56);

            k *= M;
            k ^= k >>> R;
            k *= M;
            h ^= k;
            h *= M;
        }

        // 尾部不足 8 字节
        int remaining = length - blockEnd;
        if (remaining > 0) {
            for (int i = remaining - 1; i >= 0; i--) {
                h ^= ((long) data[blockEnd + i] & 0xff) << (8 * i);
            }
            h *= M;
        }

        h ^= h >>> R;
        h *= M;
        h ^= h >>> R;
        return h;
    }
}
