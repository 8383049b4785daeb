package cn.gm.light.bloom.lock;

import cn.gm.light.bloom.enums.LockType;
import cn.gm.light.bloom.exception.BloomException;

/**
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @description 按锁策略创建锁实例，每次调用都返回新实例
 * @date 2026/10/12 11:31:09
 */
public final class FilterLocks {
    private FilterLocks() {
    }

    public static FilterLock create(LockType lockType) {
        if (lockType == null) {
            throw BloomException.invalidLockPolicy("lock policy is null");
        }
        switch (lockType) {
            case NONE:
                return new NoopFilterLock();
            case EXCLUSIVE:
                return new ExclusiveFilterLock();
            case SHARED_EXCLUSIVE:
                return new SharedExclusiveFilterLock();
            default:
                throw BloomException.invalidLockPolicy("unrecognized lock policy: " + lockType);
        }
    }
}
