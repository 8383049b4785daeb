package cn.gm.light.bloom.enums;

/**
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @description 过滤器错误分类
 * @date 2026/10/12 10:21:37
 */
public enum ErrorType {
    // n 为 0、误判率不在 (0,1) 内、增长因子不大于 0
    INVALID_PARAMETER(1001),
    // 无法识别的锁策略
    INVALID_LOCK_POLICY(1002),
    // 哈希提供者给不出 k 个哈希函数
    HASH_PROVIDER_FAILURE(1003),
    ;

    private final int code;

    ErrorType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
