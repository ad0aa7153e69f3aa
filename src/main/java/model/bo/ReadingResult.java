package model.bo;

import common.consts.AxisTypeEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 单次计量结果 (值对象，构造后不可变)
 * observed = base + correction，v15 = observed * vcf，mass = v15 * density15
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ReadingResult {
    private final String tankName;
    private final AxisTypeEnum axis;
    private final double levelCm;
    private final double trim;
    private final String heelLabel;

    private final double baseVolumeM3;      // 基础舱容
    private final double heelCorrectionM3;  // 横倾修正
    private final double observedVolumeM3;  // 观测体积
    private final double density15KgM3;     // 15°C 密度
    private final double temperatureC;      // 油温
    private final double vcf;               // 体积修正系数
    private final double volumeAt15cM3;     // 15°C 标准体积
    private final double massKg;            // 质量 (kg)

    public double getMassTonnes() {
        return massKg / 1000.0;
    }
}
