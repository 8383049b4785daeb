package cn.gm.light.bloom.config;

import cn.gm.light.bloom.enums.LockType;
import cn.gm.light.bloom.hash.HashProvider;
import cn.gm.light.bloom.hash.Murmur3HashProvider;
import lombok.Data;

/**
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @description 过滤器构造参数
 * @date 2026/10/13 14:17:52
 */
@Data
public class BloomConfig {
    // 预估元素数量，必填
    private long elementCountEstimate;
    // 目标误判率，必填，(0,1)
    private double falsePositiveRate;

    private HashProvider hashProvider = new Murmur3HashProvider();

    private LockType lockType = LockType.EXCLUSIVE;
    // 仅分层过滤器使用，每追加一层误判率乘以该值
    private Double falsePositiveGrowth;
}
