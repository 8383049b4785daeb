package cn.gm.light.bloom.lock;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.StampedLock;

/**
 * 读写分离：任意多个共享获取可以并行，独占获取排斥所有其他获取。
 * <p>
 * 基于 {@link StampedLock} 的读写视图，不可重入，也没有公平策略；
 * 持续的读压力下写线程可能饥饿。
 *
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @date 2026/10/12 11:20:40
 */
public class SharedExclusiveFilterLock implements FilterLock {
    private final Lock readLock;
    private final Lock writeLock;

    public SharedExclusiveFilterLock() {
        ReadWriteLock view = new StampedLock().asReadWriteLock();
        this.readLock = view.readLock();
        this.writeLock = view.writeLock();
    }

    @Override
    public void lockExclusive() {
        writeLock.lock();
    }

    @Override
    public void unlockExclusive() {
        writeLock.unlock();
    }

    @Override
    public void lockShared() {
        readLock.lock();
    }

    @Override
    public void unlockShared() {
        readLock.unlock();
    }
}
