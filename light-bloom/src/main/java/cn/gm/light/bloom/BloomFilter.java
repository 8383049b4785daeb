package cn.gm.light.bloom;

import cn.gm.light.bloom.entity.FilterStats;

import java.nio.charset.StandardCharsets;

/**
 * 近似成员判定：test 返回 false 表示一定不存在，返回 true 表示可能存在。
 * 不支持删除，也不保存元素本身。
 *
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @date 2026/10/12 16:02:31
 */
public interface BloomFilter {
    // 添加单个元素
    void add(byte[] element);

    // 检查元素是否可能存在
    boolean test(byte[] element);

    FilterStats stats();

    // 批量添加元素
    default void addAll(Iterable<byte[]> elements) {
        for (byte[] element : elements) {
            add(element);
        }
    }

    default void add(String element) {
        add(element.getBytes(StandardCharsets.UTF_8));
    }

    default boolean test(String element) {
        return test(element.getBytes(StandardCharsets.UTF_8));
    }
}
