package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 液位读数类型枚举
 * 测深与空距互斥：一条舱容记录只属于其中一种
 */
@Getter
@AllArgsConstructor
public enum AxisTypeEnum {
    SOUNDING("sounding", "测深", "sounding_cm"),  // 自舱底量到液面
    ULLAGE("ullage", "空距", "ullage_cm");        // 自舱顶量到液面

    private final String code;
    private final String desc;
    private final String column; // 归一化舱容表中的列名

    //  根据 code 获取枚举对象 (忽略大小写)
    public static AxisTypeEnum getByCode(String code) {
        if (code == null) {
            return null;
        }
        for (AxisTypeEnum value : values()) {
            if (value.getCode().equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return null;
    }

    public static AxisTypeEnum of(boolean sounding) {
        return sounding ? SOUNDING : ULLAGE;
    }
}
