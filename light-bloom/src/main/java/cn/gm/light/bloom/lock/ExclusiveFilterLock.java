package cn.gm.light.bloom.lock;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 单把互斥锁，共享获取等同于独占获取，读写完全串行。
 */
public class ExclusiveFilterLock implements FilterLock {
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public void lockExclusive() {
        lock.lock();
    }

    @Override
    public void unlockExclusive() {
        lock.unlock();
    }

    @Override
    public void lockShared() {
        lock.lock();
    }

    @Override
    public void unlockShared() {
        lock.unlock();
    }
}
