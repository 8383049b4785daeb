package cn.gm.light.bloom.enums;

import cn.gm.light.bloom.exception.BloomException;

import java.util.Locale;

/**
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @description 位数组的并发控制策略
 * @date 2026/10/12 10:26:02
 */
public enum LockType {
    // 不加锁，只能单线程使用
    NONE,
    // 互斥锁，读写完全串行
    EXCLUSIVE,
    // 读写锁，读读并发，写独占
    SHARED_EXCLUSIVE,
    ;

    /**
     * 从文本配置解析锁策略，接受 none / exclusive / shared-exclusive，忽略大小写，'-' 与 '_' 等价。
     */
    public static LockType of(String name) {
        if (name == null) {
            throw BloomException.invalidLockPolicy("lock policy is null");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (LockType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw BloomException.invalidLockPolicy("unrecognized lock policy: " + name);
    }
}
