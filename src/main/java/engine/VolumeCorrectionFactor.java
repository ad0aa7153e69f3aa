package engine;

/**
 * 体积修正系数 VCF (ASTM 54B 闭式近似)
 *
 * dT = t - 15
 * VCF = exp(-alpha * dT * (1 + 0.8 * alpha * dT))
 *
 * alpha 按 15°C 密度分段 (kg/m3)：
 * rho <= 770          (346.42278 + 0.43884 * rho) / rho^2
 * 770 < rho < 778     -0.0033612 + 2680.32 / rho^2  (过渡区)
 * 778 <= rho < 839    594.5418 / rho^2
 * rho >= 839          (186.9696 + 0.48618 * rho) / rho^2
 *
 * 不做入参校验，非正密度由调用方拒绝。
 */
public final class VolumeCorrectionFactor {

    public static final double REFERENCE_TEMPERATURE_C = 15.0;

    // 15°C 水密度 (kg/m3)
    public static final double WATER_DENSITY_15C = 999.016;

    private VolumeCorrectionFactor() {}

    public static double compute(double density15KgM3, double temperatureC) {
        double dT = temperatureC - REFERENCE_TEMPERATURE_C;
        double alpha = alpha(density15KgM3);
        return Math.exp(-alpha * dT * (1.0 + 0.8 * alpha * dT));
    }

    /**
     * 热膨胀系数 边界为精确比较
     */
    public static double alpha(double rho) {
        double rho2 = rho * rho;
        if (rho <= 770.0) {
            return (346.42278 + 0.43884 * rho) / rho2;
        }
        if (rho < 778.0) {
            return -0.0033612 + 2680.32 / rho2;
        }
        if (rho < 839.0) {
            return 594.5418 / rho2;
        }
        return (186.9696 + 0.48618 * rho) / rho2;
    }

    /**
     * 15°C 比重换算为 15°C 密度 (kg/m3)
     */
    public static double densityFromSg15(double sg15) {
        return sg15 * WATER_DENSITY_15C;
    }
}
