package service.calibration;

import common.consts.AxisTypeEnum;
import common.consts.HeelSideEnum;
import lombok.Getter;
import model.dto.request.CalibrationRowDto;
import model.entity.CalibrationPoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 舱容表数据校验与转换
 * 原始行 -> CalibrationPoint；不合格的行丢弃，所有问题都作为 issue 返回，不静默吞掉。
 */
@Component
public class CalibrationValidator {

    public Outcome validate(List<CalibrationRowDto> rows) {
        Outcome outcome = new Outcome();
        Set<String> seen = new HashSet<>();
        int line = 0;
        for (CalibrationRowDto row : rows) {
            line++;
            CalibrationPoint point = toPoint(row, line, outcome.issues);
            if (point == null) {
                continue;
            }
            String groupKey = point.getTankName() + "|" + point.getAxis() + "|" + point.getTrim()
                    + "|" + point.getHeelCode() + "|" + point.getAxisValueCm();
            if (!seen.add(groupKey)) {
                outcome.issues.add(String.format("第 %d 行: 舱 [%s] %s %s cm (纵倾 %s, 横倾 %s) 重复，以后出现的为准",
                        line, point.getTankName(), point.getAxis().getDesc(), point.getAxisValueCm(),
                        point.getTrim(), point.getHeelCode() == null ? "-" : point.getHeelCode()));
            }
            outcome.points.add(point);
        }
        return outcome;
    }

    private CalibrationPoint toPoint(CalibrationRowDto row, int line, List<String> issues) {
        String name = row.getName() == null ? "" : row.getName().trim();
        if (name.isEmpty()) {
            issues.add(String.format("第 %d 行: 舱名为空，已跳过", line));
            return null;
        }

        Double sounding = finite(row.getSoundingCm());
        Double ullage = finite(row.getUllageCm());
        if (sounding != null && ullage != null) {
            issues.add(String.format("第 %d 行: 舱 [%s] 同时有测深和空距，已跳过", line, name));
            return null;
        }
        if (sounding == null && ullage == null) {
            issues.add(String.format("第 %d 行: 舱 [%s] 缺少测深/空距读数，已跳过", line, name));
            return null;
        }
        AxisTypeEnum axis = sounding != null ? AxisTypeEnum.SOUNDING : AxisTypeEnum.ULLAGE;
        double axisValue = sounding != null ? sounding : ullage;
        if (axisValue < 0) {
            issues.add(String.format("第 %d 行: 舱 [%s] %s为负 (%s)，已跳过", line, name, axis.getDesc(), axisValue));
            return null;
        }

        // -0.0 与 0.0 归为同一纵倾
        Double trim = finite(row.getTrim()) == null ? null : row.getTrim() + 0.0;
        String heel = row.getHeel() == null || row.getHeel().trim().isEmpty()
                ? null : row.getHeel().trim().toUpperCase();
        Double volume = finite(row.getVolumeM3());
        Double correction = finite(row.getCorrectionM3());

        if (heel == null) {
            if (volume == null) {
                issues.add(String.format("第 %d 行: 舱 [%s] 基础行缺少 volume_m3，已跳过", line, name));
                return null;
            }
            if (correction != null) {
                issues.add(String.format("第 %d 行: 舱 [%s] 基础行同时有 correction_m3，已忽略修正量", line, name));
            }
            return CalibrationPoint.base(name, axis, axisValue, trim, volume);
        }

        if (!HeelSideEnum.isDiscreteCode(heel)) {
            issues.add(String.format("第 %d 行: 舱 [%s] 横倾代码 [%s] 不在 %s 中", line, name, heel,
                    HeelSideEnum.DISCRETE_CODES));
        }
        if (correction == null) {
            issues.add(String.format("第 %d 行: 舱 [%s] 横倾行 %s 缺少 correction_m3，已跳过", line, name, heel));
            return null;
        }
        if (volume != null) {
            issues.add(String.format("第 %d 行: 舱 [%s] 横倾行 %s 同时有 volume_m3，已忽略舱容", line, name, heel));
        }
        return CalibrationPoint.correction(name, axis, axisValue, trim, heel, correction);
    }

    private static Double finite(Double v) {
        return v == null || v.isNaN() || v.isInfinite() ? null : v;
    }

    /**
     * 校验结果
     */
    @Getter
    public static class Outcome {
        private final List<CalibrationPoint> points = new ArrayList<>();
        private final List<String> issues = new ArrayList<>();

        public boolean hasIssues() {
            return !issues.isEmpty();
        }

        public long tankCount() {
            return points.stream().map(CalibrationPoint::getTankName).filter(Objects::nonNull).distinct().count();
        }
    }
}
