package engine;

import common.exception.NoDataException;
import model.entity.AxisPoint;

import java.util.List;

/**
 * 一维线性插值 (按读数升序的 (x, y) 序列)
 * 查询值先截断到 [x_min, x_max]，表外读数返回边界值，不做外推。
 */
public final class AxisInterpolator {

    private AxisInterpolator() {}

    /**
     * @param series 按 x 严格递增的序列
     * @param x      查询读数
     * @return 插值结果
     * @throws NoDataException 序列为空
     */
    public static double interpolate(List<AxisPoint> series, double x) {
        if (series == null || series.isEmpty()) {
            throw new NoDataException();
        }
        int n = series.size();
        double xMin = series.get(0).getX();
        double xMax = series.get(n - 1).getX();
        double xx = Math.max(Math.min(x, xMax), xMin);

        // 二分查找 找到则为节点本身
        int low = 0;
        int high = n - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            double midX = series.get(mid).getX();
            if (midX < xx) {
                low = mid + 1;
            } else if (midX > xx) {
                high = mid - 1;
            } else {
                return series.get(mid).getY();
            }
        }

        // low 为插入点：左界 low-1，右界 low；缺哪边就用首/尾点
        AxisPoint lo = low - 1 >= 0 ? series.get(low - 1) : series.get(0);
        AxisPoint hi = low < n ? series.get(low) : series.get(n - 1);
        return lerp(xx, lo.getX(), lo.getY(), hi.getX(), hi.getY());
    }

    /**
     * 两点线性插值 x0 == x1 时直接返回 y0
     */
    public static double lerp(double x, double x0, double y0, double x1, double y1) {
        if (x1 == x0) {
            return y0;
        }
        double t = (x - x0) / (x1 - x0);
        return (1 - t) * y0 + t * y1;
    }
}
