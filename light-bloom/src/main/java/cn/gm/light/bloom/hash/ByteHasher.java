package cn.gm.light.bloom.hash;

/**
 * 字节序列到 64 位摘要的确定性哈希函数，结果按无符号数解释。
 * <p>
 * 实现不能在调用之间保留状态，同一个实例会被多个线程同时调用。
 */
@FunctionalInterface
public interface ByteHasher {
    long hash(byte[] data);
}
