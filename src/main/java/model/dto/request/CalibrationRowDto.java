package model.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 归一化舱容表的一行原始数据
 * 列：name,sounding_cm,ullage_cm,trim,heel,volume_m3,correction_m3
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationRowDto {
    private String name;
    private Double soundingCm;
    private Double ullageCm;
    private Double trim;
    private String heel;
    private Double volumeM3;
    private Double correctionM3;
}
