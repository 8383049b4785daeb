package cn.gm.light.bloom.lock;

// 不加锁：调用方自行保证单线程访问，否则并发 add 属于数据竞争
public class NoopFilterLock implements FilterLock {
    @Override
    public void lockExclusive() {
    }

    @Override
    public void unlockExclusive() {
    }

    @Override
    public void lockShared() {
    }

    @Override
    public void unlockShared() {
    }
}
