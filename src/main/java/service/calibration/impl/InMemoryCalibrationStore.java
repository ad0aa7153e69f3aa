package service.calibration.impl;

import common.config.GaugingConfig;
import common.consts.AxisTypeEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import model.dto.request.CalibrationRowDto;
import model.dto.snapshot.TankInfoDto;
import model.entity.AxisPoint;
import model.entity.CalibrationPoint;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import service.calibration.CalibrationStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 内存舱容表
 * 读多写少：加载时整体构建新表再一次性替换引用，查询无需加锁。
 */
@Component
public class InMemoryCalibrationStore implements CalibrationStore {

    private final double trimTolerance;

    // 有纵倾的在前、横倾修正行在前，再按测深、空距升序 (无值的排前面)
    private static final Comparator<CalibrationPoint> ROW_ORDER = Comparator
            .comparing((CalibrationPoint p) -> p.getTrim() == null)
            .thenComparing(p -> p.getHeelCode() == null)
            .thenComparing(p -> p.getAxis() == AxisTypeEnum.SOUNDING ? p.getAxisValueCm() : null,
                    Comparator.nullsFirst(Comparator.<Double>naturalOrder()))
            .thenComparing(p -> p.getAxis() == AxisTypeEnum.ULLAGE ? p.getAxisValueCm() : null,
                    Comparator.nullsFirst(Comparator.<Double>naturalOrder()));

    private volatile Map<String, TankTable> tanks = Collections.emptyMap();

    @Autowired
    public InMemoryCalibrationStore(GaugingConfig gaugingConfig) {
        this(gaugingConfig.getCalibration().getTrimTolerance());
    }

    public InMemoryCalibrationStore(double trimTolerance) {
        this.trimTolerance = trimTolerance;
    }

    /**
     * 用新的舱容记录整体替换当前数据
     * 同一 (舱, 读数类型, 纵倾, 横倾代码) 分组内读数重复时后写入的覆盖先写入的
     * (重复由 CalibrationValidator 负责报告)
     */
    public void replaceAll(Collection<CalibrationPoint> points) {
        Map<String, Map<SeriesKey, TreeMap<Double, Double>>> grouped = new HashMap<>();
        Map<String, List<CalibrationPoint>> rawRows = new HashMap<>();
        for (CalibrationPoint p : points) {
            rawRows.computeIfAbsent(p.getTankName(), k -> new ArrayList<>()).add(p);
            SeriesKey key = new SeriesKey(p.getAxis(), p.getTrim(), p.getHeelCode());
            grouped.computeIfAbsent(p.getTankName(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(key, k -> new TreeMap<>())
                    .put(p.getAxisValueCm(), p.getValue());
        }

        Map<String, TankTable> rebuilt = new HashMap<>();
        grouped.forEach((tankName, seriesMap) -> {
            List<CalibrationSeries> seriesList = new ArrayList<>();
            seriesMap.forEach((key, values) -> {
                List<AxisPoint> pts = new ArrayList<>(values.size());
                values.forEach((x, y) -> pts.add(new AxisPoint(x, y)));
                seriesList.add(new CalibrationSeries(key, Collections.unmodifiableList(pts)));
            });
            List<CalibrationPoint> rows = new ArrayList<>(rawRows.get(tankName));
            rows.sort(ROW_ORDER);
            rebuilt.put(tankName, new TankTable(tankName, Collections.unmodifiableList(seriesList),
                    Collections.unmodifiableList(rows)));
        });
        this.tanks = Collections.unmodifiableMap(rebuilt);
    }

    public void clear() {
        this.tanks = Collections.emptyMap();
    }

    @Override
    public List<AxisPoint> findSeries(String tankName, AxisTypeEnum axis, Double trim, String heelCode) {
        TankTable table = tanks.get(tankName);
        if (table == null) {
            return Collections.emptyList();
        }
        for (CalibrationSeries series : table.getSeries()) {
            SeriesKey key = series.getKey();
            if (key.getAxis() == axis && heelMatches(key.getHeelCode(), heelCode) && trimMatches(key.getTrim(), trim)) {
                return series.getPoints();
            }
        }
        return Collections.emptyList();
    }

    @Override
    public List<Double> availableTrims(String tankName) {
        TankTable table = tanks.get(tankName);
        if (table == null) {
            return Collections.emptyList();
        }
        TreeSet<Double> trims = new TreeSet<>();
        for (CalibrationSeries series : table.getSeries()) {
            if (series.getKey().getTrim() != null) {
                trims.add(series.getKey().getTrim());
            }
        }
        return new ArrayList<>(trims);
    }

    @Override
    public List<String> listTanks() {
        List<String> names = new ArrayList<>(tanks.keySet());
        Collections.sort(names);
        return names;
    }

    @Override
    public List<CalibrationRowDto> listRows(String tankName, int limit) {
        TankTable table = tanks.get(tankName);
        if (table == null || limit <= 0) {
            return Collections.emptyList();
        }
        List<CalibrationRowDto> result = new ArrayList<>();
        for (CalibrationPoint p : table.getRows()) {
            if (result.size() >= limit) {
                break;
            }
            boolean sounding = p.getAxis() == AxisTypeEnum.SOUNDING;
            result.add(new CalibrationRowDto(p.getTankName(),
                    sounding ? p.getAxisValueCm() : null,
                    sounding ? null : p.getAxisValueCm(),
                    p.getTrim(), p.getHeelCode(), p.getVolumeM3(), p.getCorrectionM3()));
        }
        return result;
    }

    @Override
    public Optional<TankInfoDto> describeTank(String tankName) {
        TankTable table = tanks.get(tankName);
        if (table == null) {
            return Optional.empty();
        }
        TankInfoDto dto = new TankInfoDto();
        dto.setTankName(tankName);
        TreeSet<String> heels = new TreeSet<>();
        int rows = 0;
        for (CalibrationSeries series : table.getSeries()) {
            List<AxisPoint> pts = series.getPoints();
            rows += pts.size();
            if (series.getKey().getHeelCode() != null) {
                heels.add(series.getKey().getHeelCode());
            }
            if (pts.isEmpty()) {
                continue;
            }
            double min = pts.get(0).getX();
            double max = pts.get(pts.size() - 1).getX();
            if (series.getKey().getAxis() == AxisTypeEnum.SOUNDING) {
                dto.setSoundingMinCm(dto.getSoundingMinCm() == null ? min : Math.min(dto.getSoundingMinCm(), min));
                dto.setSoundingMaxCm(dto.getSoundingMaxCm() == null ? max : Math.max(dto.getSoundingMaxCm(), max));
            } else {
                dto.setUllageMinCm(dto.getUllageMinCm() == null ? min : Math.min(dto.getUllageMinCm(), min));
                dto.setUllageMaxCm(dto.getUllageMaxCm() == null ? max : Math.max(dto.getUllageMaxCm(), max));
            }
        }
        dto.setRows(rows);
        dto.setTrims(availableTrims(tankName));
        dto.setHeelCodes(new ArrayList<>(heels));
        return Optional.of(dto);
    }

    private boolean trimMatches(Double stored, Double requested) {
        if (requested == null || stored == null) {
            return requested == null && stored == null;
        }
        return Math.abs(stored - requested) < trimTolerance;
    }

    private static boolean heelMatches(String stored, String requested) {
        if (requested == null || stored == null) {
            return requested == null && stored == null;
        }
        return stored.equalsIgnoreCase(requested.trim());
    }

    @Getter
    @EqualsAndHashCode
    @AllArgsConstructor
    private static class SeriesKey {
        private final AxisTypeEnum axis;
        private final Double trim;
        private final String heelCode;
    }

    @Getter
    @AllArgsConstructor
    private static class CalibrationSeries {
        private final SeriesKey key;
        private final List<AxisPoint> points;
    }

    @Getter
    @AllArgsConstructor
    private static class TankTable {
        private final String tankName;
        private final List<CalibrationSeries> series;
        private final List<CalibrationPoint> rows;
    }
}
