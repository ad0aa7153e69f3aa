package model.dto.snapshot;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 舱容表中单个舱的概况
 */
@Data
public class TankInfoDto {
    private String tankName;
    private int rows;
    private Double soundingMinCm;
    private Double soundingMaxCm;
    private Double ullageMinCm;
    private Double ullageMaxCm;
    private List<Double> trims = new ArrayList<>();
    private List<String> heelCodes = new ArrayList<>();
}
