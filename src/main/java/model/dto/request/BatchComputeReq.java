package model.dto.request;

import lombok.Data;

import java.util.List;

/**
 * 一键计算全部舱 ("compute all")
 * trim/heel 作为整船公共值，单行未填写时使用
 */
@Data
public class BatchComputeReq {
    private Double trim;
    private String heel;
    private List<ReadingComputeReq> readings;
}
