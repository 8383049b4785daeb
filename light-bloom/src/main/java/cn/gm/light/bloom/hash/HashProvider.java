package cn.gm.light.bloom.hash;

import java.util.List;

/**
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @description 给定 k，返回 k 个相互独立、分布均匀的 64 位哈希函数
 * @date 2026/10/12 14:05:51
 */
public interface HashProvider {
    List<ByteHasher> getHashes(int count);
}
