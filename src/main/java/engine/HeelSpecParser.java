package engine;

import common.consts.HeelSideEnum;
import model.bo.HeelSpec;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 横倾输入解析
 * 纯函数且对任意字符串都有结果，不抛异常。无法识别的输入按离散代码原样查表。
 *
 * 支持：空/0、P1 P2 S-1 S-2、带符号数字 (正=左倾 负=右倾，可带指数如 1E-1)、1.5P / P1.5 / 0,7 S
 */
public final class HeelSpecParser {

    private static final String NUMBER = "(\\d+(?:\\.\\d*)?|\\.\\d+)";

    // 输入已转大写 指数只会是 E；不接受十六进制与 d/f 后缀
    private static final Pattern SIGNED_NUMBER = Pattern.compile("^[+-]?" + NUMBER + "(?:E[+-]?\\d+)?$");

    private static final Pattern NUMBER_THEN_SIDE = Pattern.compile("^" + NUMBER + "\\s*([PS])$");

    private static final Pattern SIDE_THEN_NUMBER = Pattern.compile("^([PS])\\s*" + NUMBER + "$");

    private HeelSpecParser() {}

    public static HeelSpec parse(String raw) {
        if (raw == null) {
            return HeelSpec.none();
        }
        String s = normalize(raw);
        if (s.isEmpty()) {
            return HeelSpec.none();
        }

        // 舱容表已有的离散代码
        if (HeelSideEnum.isDiscreteCode(s)) {
            return HeelSpec.discrete(s);
        }

        // 纯数字
        String numeric = s.replace(',', '.');
        if (SIGNED_NUMBER.matcher(numeric).matches()) {
            double value = Double.parseDouble(numeric);
            if (value == 0) {
                return HeelSpec.none();
            }
            HeelSideEnum side = value > 0 ? HeelSideEnum.PORT : HeelSideEnum.STARBOARD;
            return HeelSpec.continuous(side, Math.abs(value));
        }

        // 1.5P / 2 S
        Matcher m = NUMBER_THEN_SIDE.matcher(numeric);
        if (m.matches()) {
            return sided(m.group(2), m.group(1));
        }
        // P1.5 / S 0.7
        m = SIDE_THEN_NUMBER.matcher(numeric);
        if (m.matches()) {
            return sided(m.group(1), m.group(2));
        }

        return HeelSpec.discrete(s);
    }

    private static HeelSpec sided(String sideCode, String degreesText) {
        double degrees = Double.parseDouble(degreesText);
        if (degrees == 0) {
            return HeelSpec.none();
        }
        return HeelSpec.continuous(HeelSideEnum.getByCode(sideCode), degrees);
    }

    // 去空白、转大写、去掉 DEG 与 ° 标记
    private static String normalize(String raw) {
        return raw.trim()
                .toUpperCase()
                .replace("DEG", "")
                .replace("°", "")
                .trim();
    }
}
