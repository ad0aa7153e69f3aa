package engine;

import common.consts.HeelSideEnum;
import model.bo.HeelSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("横倾输入解析")
class HeelSpecParserTest {

    @Test
    @DisplayName("空输入与 0 视为无横倾")
    void blankAndZeroAreNone() {
        assertEquals(HeelSpec.none(), HeelSpecParser.parse(null));
        assertEquals(HeelSpec.none(), HeelSpecParser.parse(""));
        assertEquals(HeelSpec.none(), HeelSpecParser.parse("   "));
        assertEquals(HeelSpec.none(), HeelSpecParser.parse("0"));
        assertEquals(HeelSpec.none(), HeelSpecParser.parse("-0.0"));
        assertEquals(HeelSpec.none(), HeelSpecParser.parse("0P"));
        assertEquals(HeelSpec.none(), HeelSpecParser.parse("S 0"));
    }

    @Test
    @DisplayName("已知离散代码不区分大小写")
    void discreteCodes() {
        assertEquals(HeelSpec.discrete("P1"), HeelSpecParser.parse("P1"));
        assertEquals(HeelSpec.discrete("P2"), HeelSpecParser.parse(" p2 "));
        assertEquals(HeelSpec.discrete("S-1"), HeelSpecParser.parse("s-1"));
        assertEquals(HeelSpec.discrete("S-2"), HeelSpecParser.parse("S-2"));
    }

    @Test
    @DisplayName("带符号数字：正为左倾，负为右倾")
    void signedNumbers() {
        assertEquals(HeelSpec.continuous(HeelSideEnum.STARBOARD, 0.5), HeelSpecParser.parse("-0.5"));
        assertEquals(HeelSpec.continuous(HeelSideEnum.PORT, 1.25), HeelSpecParser.parse("1.25"));
        assertEquals(HeelSpec.continuous(HeelSideEnum.PORT, 0.75), HeelSpecParser.parse("+0,75"));
    }

    @Test
    @DisplayName("带指数的数字同样按角度处理")
    void exponentNumbers() {
        assertEquals(HeelSpec.continuous(HeelSideEnum.PORT, 0.1), HeelSpecParser.parse("1e-1"));
        assertEquals(HeelSpec.continuous(HeelSideEnum.STARBOARD, 2.0), HeelSpecParser.parse("-2E0"));
        assertEquals(HeelSpec.continuous(HeelSideEnum.PORT, 1.5), HeelSpecParser.parse("+1.5e0 deg"));
        assertEquals(HeelSpec.none(), HeelSpecParser.parse("0e5"));
    }

    @Test
    @DisplayName("十六进制与 d/f 后缀不当作数字")
    void rejectsNonDecimalNumberForms() {
        assertEquals(HeelSpec.discrete("0X1"), HeelSpecParser.parse("0x1"));
        assertEquals(HeelSpec.discrete("1D"), HeelSpecParser.parse("1d"));
        assertEquals(HeelSpec.discrete("1F"), HeelSpecParser.parse("1f"));
        assertEquals(HeelSpec.discrete("NAN"), HeelSpecParser.parse("NaN"));
    }

    @Test
    @DisplayName("数字加方向或方向加数字")
    void sidedDegrees() {
        assertEquals(HeelSpec.continuous(HeelSideEnum.PORT, 1.5), HeelSpecParser.parse("1.5P"));
        assertEquals(HeelSpec.continuous(HeelSideEnum.STARBOARD, 0.7), HeelSpecParser.parse("0.7 s"));
        assertEquals(HeelSpec.continuous(HeelSideEnum.PORT, 1.5), HeelSpecParser.parse("P1.5"));
        assertEquals(HeelSpec.continuous(HeelSideEnum.STARBOARD, 0.3), HeelSpecParser.parse("S 0,3"));
        assertEquals(HeelSpec.continuous(HeelSideEnum.STARBOARD, 1.0), HeelSpecParser.parse("S1"));
        assertEquals(HeelSpec.continuous(HeelSideEnum.PORT, 1.5), HeelSpecParser.parse("1.5° P"));
        assertEquals(HeelSpec.continuous(HeelSideEnum.PORT, 1.5), HeelSpecParser.parse("1.5 deg P"));
    }

    @Test
    @DisplayName("超过 2° 截断为 2°")
    void clampsAboveTwoDegrees() {
        HeelSpec spec = HeelSpecParser.parse("3.5S");
        assertEquals(HeelSpec.Kind.CONTINUOUS, spec.getKind());
        assertEquals(2.0, spec.getDegrees(), 0.0);
        assertEquals(2.0, HeelSpecParser.parse("-7").getDegrees(), 0.0);
    }

    @Test
    @DisplayName("无法识别的输入按离散代码原样查表")
    void unknownInputFallsBackToDiscrete() {
        assertEquals(HeelSpec.discrete("HC.X"), HeelSpecParser.parse("hc.x"));
        assertEquals(HeelSpec.discrete("1.2.3"), HeelSpecParser.parse("1.2.3"));
        assertEquals(HeelSpec.discrete("NAN"), HeelSpecParser.parse("NaN"));
        assertEquals(HeelSpec.discrete("P-1"), HeelSpecParser.parse("P-1"));
    }

    @Test
    @DisplayName("横倾标签")
    void labels() {
        assertEquals("no-heel", HeelSpecParser.parse("0").getLabel());
        assertEquals("S-2", HeelSpecParser.parse("s-2").getLabel());
        assertEquals("1.5°P", HeelSpecParser.parse("1.5P").getLabel());
    }
}
