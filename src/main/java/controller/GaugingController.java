package controller;

import common.Result;
import engine.HeelSpecParser;
import engine.VolumeCorrectionFactor;
import model.bo.ReadingResult;
import model.dto.request.BatchComputeReq;
import model.dto.request.ReadingComputeReq;
import model.dto.response.BatchComputeItemResp;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.gauging.ReadingPipeline;

import java.util.List;

/**
 * 计量接口 (界面、记录层、批处理工具共用同一计算契约)
 */
@RestController
@RequestMapping("/gauging")
public class GaugingController {

    private final ReadingPipeline readingPipeline;

    public GaugingController(ReadingPipeline readingPipeline) {
        this.readingPipeline = readingPipeline;
    }

    // 单舱计量
    @PostMapping("/compute")
    public Result compute(@RequestBody ReadingComputeReq req) {
        ReadingResult result = readingPipeline.compute(req);
        return Result.success(result);
    }

    /**
     * 一键计算全部舱 单舱失败不影响其他舱
     */
    @PostMapping("/compute-all")
    public Result computeAll(@RequestBody BatchComputeReq req) {
        List<BatchComputeItemResp> items = readingPipeline.computeAll(req);
        return Result.success("计算完成", items);
    }

    // 单独计算 VCF
    @GetMapping("/vcf")
    public Result vcf(@RequestParam double density15, @RequestParam double temperature) {
        return Result.success(VolumeCorrectionFactor.compute(density15, temperature));
    }

    // 横倾输入预解析 (界面输入提示用)
    @GetMapping("/heel/parse")
    public Result parseHeel(@RequestParam(name = "raw", required = false) String raw) {
        return Result.success(HeelSpecParser.parse(raw));
    }
}
