package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 密度单位
 */
@Getter
@AllArgsConstructor
public enum DensityUnitEnum {
    KG_M3("kg/m3", 1.0),
    KG_L("kg/L", 1000.0);

    private final String code;
    private final double toKgPerM3; // 换算到 kg/m3 的系数

    public static DensityUnitEnum getByCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return KG_M3;
        }
        String c = code.trim().replace("³", "3").replace("^", "");
        for (DensityUnitEnum value : values()) {
            if (value.getCode().equalsIgnoreCase(c)) {
                return value;
            }
        }
        return null;
    }

    public double toKgPerM3(double value) {
        return value * toKgPerM3;
    }
}
