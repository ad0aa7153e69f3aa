package model.bo;

import common.consts.HeelSideEnum;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 横倾输入解析结果
 * NONE：无横倾；DISCRETE：舱容表中的离散代码；CONTINUOUS：某一侧的连续角度 (0~2°)
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HeelSpec {

    public static final double MAX_DEGREES = 2.0;

    private static final HeelSpec NONE = new HeelSpec(Kind.NONE, null, null, 0.0);

    private final Kind kind;
    private final String code;         // 仅 DISCRETE
    private final HeelSideEnum side;   // 仅 CONTINUOUS
    private final double degrees;      // 仅 CONTINUOUS，已截断到 [0, 2]

    public static HeelSpec none() {
        return NONE;
    }

    public static HeelSpec discrete(String code) {
        return new HeelSpec(Kind.DISCRETE, code, null, 0.0);
    }

    public static HeelSpec continuous(HeelSideEnum side, double degrees) {
        return new HeelSpec(Kind.CONTINUOUS, null, side, Math.min(degrees, MAX_DEGREES));
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    /**
     * 用于结果展示的横倾标签：no-heel / P1 / 1.5°P
     */
    public String getLabel() {
        switch (kind) {
            case DISCRETE:
                return code;
            case CONTINUOUS:
                return degrees + "°" + side.getCode();
            default:
                return "no-heel";
        }
    }

    public enum Kind {
        NONE,
        DISCRETE,
        CONTINUOUS
    }
}
