package cn.gm.light.bloom.entity;

import com.alibaba.fastjson2.JSON;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * @author 明溪
 * @version 1.0
 * @project lightBloom
 * @description 过滤器状态快照，只用于观测，不参与判定
 * @date 2026/10/13 09:12:44
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterStats implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String KIND_STANDARD = "standard";
    public static final String KIND_SCALABLE = "scalable";

    private String kind;
    // 总位数，分层过滤器为各层之和
    private long bitCount;
    // 分层过滤器不填
    private int hashCount;
    private long setBits;
    private double fillRatio;
    private double estimatedFalsePositiveRate;
    private long insertions;

    private int layerCount;
    private long elementCount;
    private List<FilterStats> layers;

    public String toJson() {
        return JSON.toJSONString(this);
    }
}
