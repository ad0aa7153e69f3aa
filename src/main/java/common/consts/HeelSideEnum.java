package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 横倾方向枚举
 * 每一侧在舱容表中只有 1° 与 2° 两个锚点代码
 */
@Getter
@AllArgsConstructor
public enum HeelSideEnum {
    PORT("P", "左倾", "P1", "P2"),
    STARBOARD("S", "右倾", "S-1", "S-2");

    private final String code;
    private final String desc;
    private final String oneDegreeCode;  // 1° 锚点
    private final String twoDegreeCode;  // 2° 锚点

    // 舱容表定义的全部离散横倾代码
    public static final List<String> DISCRETE_CODES = List.of("P1", "P2", "S-1", "S-2");

    public static HeelSideEnum getByCode(String code) {
        for (HeelSideEnum value : values()) {
            if (value.getCode().equalsIgnoreCase(code)) {
                return value;
            }
        }
        return null;
    }

    public static boolean isDiscreteCode(String code) {
        return code != null && DISCRETE_CODES.contains(code.trim().toUpperCase());
    }
}
