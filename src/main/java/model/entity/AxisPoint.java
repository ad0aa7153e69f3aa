package model.entity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 插值序列中的一个点 (读数, 值)
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class AxisPoint {
    private final double x;
    private final double y;
}
