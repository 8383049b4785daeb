package cn.gm.light.bloom.exception;

import cn.gm.light.bloom.enums.ErrorType;

/**
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @description 过滤器统一异常，构造失败或扩容失败时同步抛给调用方
 * @date 2026/10/12 10:33:48
 */
public class BloomException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final ErrorType errorType;

    public BloomException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    // 带异常根源的构造方法
    public BloomException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public static BloomException invalidParameter(String message) {
        return new BloomException(ErrorType.INVALID_PARAMETER, message);
    }

    public static BloomException invalidLockPolicy(String message) {
        return new BloomException(ErrorType.INVALID_LOCK_POLICY, message);
    }

    public static BloomException hashProviderFailure(String message) {
        return new BloomException(ErrorType.HASH_PROVIDER_FAILURE, message);
    }

    public static BloomException hashProviderFailure(String message, Throwable cause) {
        return new BloomException(ErrorType.HASH_PROVIDER_FAILURE, message, cause);
    }

    public ErrorType getErrorType() { return errorType; }

    public int getCode() { return errorType.getCode(); }
}
