package controller;

import common.Result;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.gauging.GaugingErrorLog;

import java.util.List;

/**
 * 计量错误日志查询接口
 */
@RestController
@RequestMapping("/gauging/errors")
public class GaugingErrorController {

    private final GaugingErrorLog errorLog;

    public GaugingErrorController(GaugingErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    /**
     * 查询某时间点 (毫秒时间戳) 之后的错误日志
     */
    @GetMapping
    public Result listErrors(@RequestParam(name = "since", defaultValue = "0") long sinceMillis) {
        List<GaugingErrorLog.ErrorLogEntry> entries = errorLog.listSince(sinceMillis);
        return Result.success("查询成功", entries);
    }

    /**
     * 查询所有错误日志
     */
    @GetMapping("/all")
    public Result listAllErrors() {
        List<GaugingErrorLog.ErrorLogEntry> entries = errorLog.listAll();
        return Result.success("查询成功", entries);
    }
}
