package cn.gm.light.bloom.hash;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.util.ArrayList;
import java.util.List;

/**
 * 默认哈希族：第 i 个函数为种子 i 的 murmur3_128，取低 64 位。
 * Guava 的 {@link HashFunction} 无状态，可以并发调用。
 *
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @date 2026/10/12 14:12:26
 */
public class Murmur3HashProvider implements HashProvider {

    @Override
    public List<ByteHasher> getHashes(int count) {
        List<ByteHasher> hashers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            HashFunction function = Hashing.murmur3_128(i);
            hashers.add(data -> function.hashBytes(data).asLong());
        }
        return hashers;
    }
}
