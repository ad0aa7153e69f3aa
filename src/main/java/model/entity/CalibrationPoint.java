package model.entity;

import common.consts.AxisTypeEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 舱容表中的一条记录 (只读)
 * 基础行：heelCode 为空，volumeM3 有值
 * 修正行：heelCode 非空，correctionM3 有值 (带符号)
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class CalibrationPoint {
    private final String tankName;     // 舱名 每个物理舱唯一
    private final AxisTypeEnum axis;   // 测深 / 空距
    private final double axisValueCm;  // 读数 (cm)
    private final Double trim;         // 纵倾 (m)，为空表示与纵倾无关的记录
    private final String heelCode;     // 横倾代码 P1/P2/S-1/S-2，仅修正行有
    private final Double volumeM3;     // 基础舱容
    private final Double correctionM3; // 横倾修正量

    public static CalibrationPoint base(String tankName, AxisTypeEnum axis, double axisValueCm,
                                        Double trim, double volumeM3) {
        return new CalibrationPoint(tankName, axis, axisValueCm, trim, null, volumeM3, null);
    }

    public static CalibrationPoint correction(String tankName, AxisTypeEnum axis, double axisValueCm,
                                              Double trim, String heelCode, double correctionM3) {
        return new CalibrationPoint(tankName, axis, axisValueCm, trim, heelCode, null, correctionM3);
    }

    public boolean isCorrectionRow() {
        return heelCode != null;
    }

    /**
     * 插值用的值：基础行取舱容，修正行取修正量
     */
    public double getValue() {
        return isCorrectionRow() ? correctionM3 : volumeM3;
    }
}
