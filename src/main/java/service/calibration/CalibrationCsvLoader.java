package service.calibration;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.CalibrationRowDto;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 归一化舱容表 CSV 读取
 *
 * <p>表头必须包含 name,sounding_cm,ullage_cm,trim,heel,volume_m3,correction_m3 (顺序不限)。
 * 数值列宽松解析：无法解析的值按空值处理，由 {@link CalibrationValidator} 决定是否保留该行。</p>
 */
@Component
@Slf4j
public class CalibrationCsvLoader {

    public static final String FILE_SUFFIX = "_normalized.csv";

    static final List<String> REQUIRED_COLUMNS = List.of(
            "name", "sounding_cm", "ullage_cm", "trim", "heel", "volume_m3", "correction_m3");

    /**
     * 读取单个文件，或目录下全部 *_normalized.csv (按文件名排序)
     */
    public List<CalibrationRowDto> load(Path location) throws IOException {
        Objects.requireNonNull(location, "location");
        if (!Files.exists(location)) {
            throw new BusinessException(ErrorCodes.CALIBRATION_LOCATION_NOT_FOUND + ": " + location);
        }
        if (!Files.isDirectory(location)) {
            return parse(location);
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(location, "*" + FILE_SUFFIX)) {
            for (Path p : stream) {
                files.add(p);
            }
        }
        files.sort(null);
        if (files.isEmpty()) {
            log.warn("目录 {} 下没有 *{} 文件", location, FILE_SUFFIX);
        }

        List<CalibrationRowDto> rows = new ArrayList<>();
        for (Path file : files) {
            rows.addAll(parse(file));
        }
        return rows;
    }

    public List<CalibrationRowDto> parse(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<CalibrationRowDto> rows = parse(reader, file.getFileName().toString());
            log.info("读取舱容表 {}: {} 行", file.getFileName(), rows.size());
            return rows;
        }
    }

    /**
     * @param reader 舱容表内容
     * @param source 来源名 (用于报错)
     */
    public List<CalibrationRowDto> parse(Reader reader, String source) throws IOException {
        Objects.requireNonNull(reader, "reader");

        try (BufferedReader bufferedReader = reader instanceof BufferedReader br ? br : new BufferedReader(reader)) {
            String header = bufferedReader.readLine();
            if (header == null) {
                return new ArrayList<>();
            }
            Map<String, Integer> columns = indexColumns(header);
            List<String> missing = new ArrayList<>();
            for (String col : REQUIRED_COLUMNS) {
                if (!columns.containsKey(col)) {
                    missing.add(col);
                }
            }
            if (!missing.isEmpty()) {
                throw new BusinessException(ErrorCodes.CALIBRATION_MISSING_COLUMNS + " " + missing + ": " + source);
            }

            List<CalibrationRowDto> rows = new ArrayList<>();
            String line;
            while ((line = bufferedReader.readLine()) != null) {
                if (line.trim().isEmpty()) {
                    continue;
                }
                List<String> cells = splitCells(line);
                CalibrationRowDto row = new CalibrationRowDto();
                row.setName(text(cells, columns.get("name")));
                row.setSoundingCm(number(cells, columns.get("sounding_cm")));
                row.setUllageCm(number(cells, columns.get("ullage_cm")));
                row.setTrim(number(cells, columns.get("trim")));
                row.setHeel(text(cells, columns.get("heel")));
                row.setVolumeM3(number(cells, columns.get("volume_m3")));
                row.setCorrectionM3(number(cells, columns.get("correction_m3")));
                rows.add(row);
            }
            return rows;
        }
    }

    private static Map<String, Integer> indexColumns(String header) {
        // 去掉 UTF-8 BOM
        String h = header.startsWith("\uFEFF") ? header.substring(1) : header;
        List<String> names = splitCells(h);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            columns.put(names.get(i).trim().toLowerCase(Locale.ROOT), i);
        }
        return columns;
    }

    private static String text(List<String> cells, int index) {
        if (index >= cells.size()) {
            return null;
        }
        String v = cells.get(index).trim();
        return v.isEmpty() ? null : v;
    }

    private static Double number(List<String> cells, int index) {
        String v = text(cells, index);
        if (v == null) {
            return null;
        }
        try {
            return Double.valueOf(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 按逗号拆分一行 双引号内的逗号不拆分，"" 表示一个引号
     */
    static List<String> splitCells(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        cell.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString());
        return cells;
    }
}
