package cn.gm.light.bloom.lock;

/**
 * 位数组的并发控制策略。每个过滤器独占一个实例，不在过滤器或分层之间共享。
 * <p>
 * add 走独占侧，test 走共享侧；具体是否真正区分读写由实现决定。
 *
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @date 2026/10/12 11:02:14
 */
public interface FilterLock {
    void lockExclusive();

    void unlockExclusive();

    void lockShared();

    void unlockShared();
}
