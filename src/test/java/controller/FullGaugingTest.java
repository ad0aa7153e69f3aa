package controller;

import common.Result;
import common.exception.NoBaseVolumeException;
import model.bo.ReadingResult;
import model.dto.request.BatchComputeReq;
import model.dto.request.CalibrationRowDto;
import model.dto.request.CalibrationSnapReq;
import model.dto.request.ReadingComputeReq;
import model.dto.response.BatchComputeItemResp;
import model.dto.response.CalibrationLoadResp;
import model.dto.snapshot.TankInfoDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import service.calibration.CalibrationStore;
import service.gauging.GaugingErrorLog;
import service.gauging.ReadingPipeline;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 计量服务整体测试
 * 启动时从 src/test/resources/calibration 加载舱容表
 */
@SpringBootTest(classes = application.GaugingApplication.class)
@AutoConfigureMockMvc
@DisplayName("计量服务整体测试")
@Timeout(60)
class FullGaugingTest {

    private static final double EPS = 1e-9;

    @Autowired
    private CalibrationController calibrationController;

    @Autowired
    private GaugingController gaugingController;

    @Autowired
    private ReadingPipeline readingPipeline;

    @Autowired
    private CalibrationStore calibrationStore;

    @Autowired
    private GaugingErrorLog errorLog;

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        errorLog.clear();
        // 其他用例可能推送过快照，每次重新加载测试舱容表
        Result result = calibrationController.load(null);
        assertTrue(result.isSuccess());
    }

    private static ReadingComputeReq sounding(String tank, double trim, double level, String heel) {
        return new ReadingComputeReq(tank, trim, level, true, null, heel, 850.0, null, 15.0);
    }

    @Test
    @DisplayName("加载舱容表：舱清单、概况、数据问题")
    void testLoadAndInventory() {
        Result result = calibrationController.load(null);
        CalibrationLoadResp resp = (CalibrationLoadResp) result.getData();
        assertEquals(23, resp.getRowsRead());
        assertEquals(22, resp.getPointsLoaded());
        assertEquals(2, resp.getTankCount());
        assertEquals(2, resp.getIssues().size());

        assertEquals(List.of("FO1P", "GO2C"), calibrationStore.listTanks());

        TankInfoDto info = calibrationStore.describeTank("FO1P").orElseThrow();
        assertEquals(0.0, info.getSoundingMinCm(), EPS);
        assertEquals(200.0, info.getSoundingMaxCm(), EPS);
        assertEquals(List.of(-2.0, 0.0, 2.0), info.getTrims());
        assertEquals(List.of("P1", "P2", "S-1", "S-2"), info.getHeelCodes());

        Result missing = calibrationController.describeTank("NOPE");
        assertEquals(Result.CODE_NOT_FOUND, missing.getCode());

        long issues = errorLog.listAll().stream()
                .filter(e -> e.getErrorType() == GaugingErrorLog.ErrorType.CALIBRATION_ISSUE)
                .count();
        assertTrue(issues >= 2, "加载问题应记入错误日志");
    }

    @Test
    @DisplayName("单舱原始记录：排序、条数限制、重复行保留")
    void testListRows() throws Exception {
        List<CalibrationRowDto> first = calibrationStore.listRows("FO1P", 3);
        assertEquals(3, first.size());
        // 有纵倾的基础行在前，测深为空 (空距行) 的排在最前
        assertEquals(0.0, first.get(0).getUllageCm(), EPS);
        assertEquals(200.0, first.get(1).getUllageCm(), EPS);
        assertEquals(0.0, first.get(2).getSoundingCm(), EPS);
        assertEquals(0.0, first.get(2).getTrim(), EPS);
        assertNull(first.get(2).getHeel());

        List<CalibrationRowDto> all = calibrationStore.listRows("FO1P", 100);
        assertEquals(19, all.size());
        assertNull(all.get(all.size() - 1).getTrim());
        assertNotNull(all.get(all.size() - 1).getHeel());

        assertEquals(3, calibrationStore.listRows("GO2C", 30).size());
        assertTrue(calibrationStore.listRows("NOPE", 30).isEmpty());

        mockMvc.perform(get("/calibration/tanks/FO1P/rows").param("limit", "2"))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.length()").value(2));
        mockMvc.perform(get("/calibration/tanks/NOPE/rows"))
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    @DisplayName("基础舱容、横倾修正、空距与跨纵倾插值")
    void testComputeVariants() {
        ReadingResult base = readingPipeline.compute(sounding("FO1P", 0.0, 150.0, null));
        assertEquals(155.0, base.getBaseVolumeM3(), EPS);
        assertEquals(0.0, base.getHeelCorrectionM3(), EPS);
        assertEquals(1.0, base.getVcf(), EPS);
        assertEquals(155.0 * 850.0, base.getMassKg(), 1e-6);
        assertEquals("no-heel", base.getHeelLabel());

        ReadingResult p1 = readingPipeline.compute(sounding("FO1P", 0.0, 150.0, "p1"));
        assertEquals(1.5, p1.getHeelCorrectionM3(), EPS);
        assertEquals(156.5, p1.getObservedVolumeM3(), EPS);
        assertEquals("P1", p1.getHeelLabel());

        ReadingResult continuous = readingPipeline.compute(sounding("FO1P", 0.0, 150.0, "1.5P"));
        assertEquals(3.0, continuous.getHeelCorrectionM3(), EPS);

        ReadingResult ullage = readingPipeline.compute(
                new ReadingComputeReq("FO1P", 0.0, 50.0, null, "ullage", null, 850.0, null, 15.0));
        assertEquals(157.5, ullage.getBaseVolumeM3(), EPS);

        ReadingResult crossTrim = readingPipeline.compute(sounding("FO1P", 1.0, 100.0, null));
        assertEquals(105.0, crossTrim.getBaseVolumeM3(), EPS);

        // 重复读数以后出现的为准
        ReadingResult duplicate = readingPipeline.compute(sounding("GO2C", 0.0, 50.0, null));
        assertEquals(25.0, duplicate.getBaseVolumeM3(), EPS);
    }

    @Test
    @DisplayName("无基础舱容时返回 404 并记录错误")
    void testNoBaseVolume() throws Exception {
        assertThrows(NoBaseVolumeException.class,
                () -> readingPipeline.compute(sounding("NOPE", 0.0, 10.0, null)));

        mockMvc.perform(post("/gauging/compute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tankName\":\"NOPE\",\"trim\":0,\"levelCm\":10,\"sounding\":true,"
                                + "\"density15\":850,\"temperatureC\":15}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(404));

        assertTrue(errorLog.listAll().stream()
                .anyMatch(e -> e.getErrorType() == GaugingErrorLog.ErrorType.READING_ERROR
                        && "NOPE".equals(e.getTankName())));
    }

    @Test
    @DisplayName("HTTP 接口：计量、参数错误、VCF、横倾解析")
    void testHttpEndpoints() throws Exception {
        mockMvc.perform(post("/gauging/compute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tankName\":\"FO1P\",\"trim\":0,\"levelCm\":150,\"sounding\":true,"
                                + "\"density15\":0.5,\"density15Unit\":\"kg/L\",\"temperatureC\":15}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.baseVolumeM3").value(155.0))
                .andExpect(jsonPath("$.data.density15KgM3").value(500.0));

        mockMvc.perform(post("/gauging/compute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tankName\":\"FO1P\",\"trim\":0,\"sounding\":true,"
                                + "\"density15\":850,\"temperatureC\":15}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(400));

        mockMvc.perform(get("/gauging/vcf").param("density15", "850").param("temperature", "15"))
                .andExpect(jsonPath("$.data").value(1.0));

        mockMvc.perform(get("/gauging/heel/parse").param("raw", "-1.2"))
                .andExpect(jsonPath("$.data.kind").value("CONTINUOUS"))
                .andExpect(jsonPath("$.data.side").value("STARBOARD"));

        mockMvc.perform(get("/calibration/tanks"))
                .andExpect(jsonPath("$.data[0]").value("FO1P"));
    }

    @Test
    @DisplayName("一键计算全部舱：单舱失败不影响其他舱")
    void testComputeAll() {
        BatchComputeReq req = new BatchComputeReq();
        req.setTrim(0.0);
        req.setReadings(List.of(
                new ReadingComputeReq("FO1P", null, 100.0, true, null, null, 850.0, null, 15.0),
                new ReadingComputeReq("NOPE", null, 100.0, true, null, null, 850.0, null, 15.0),
                new ReadingComputeReq("GO2C", null, 25.0, true, null, null, 850.0, null, 15.0)));

        Result result = gaugingController.computeAll(req);
        @SuppressWarnings("unchecked")
        List<BatchComputeItemResp> items = (List<BatchComputeItemResp>) result.getData();

        assertEquals(3, items.size());
        assertTrue(items.get(0).isSuccess());
        assertEquals(100.0, items.get(0).getResult().getBaseVolumeM3(), EPS);
        assertFalse(items.get(1).isSuccess());
        assertNotNull(items.get(1).getError());
        assertTrue(items.get(2).isSuccess());
        assertEquals(12.5, items.get(2).getResult().getBaseVolumeM3(), EPS);
    }

    @Test
    @DisplayName("推送快照整体替换舱容表")
    void testSnapshotReplacesStore() {
        CalibrationSnapReq req = new CalibrationSnapReq();
        req.setReqId("REQ-1");
        req.setVersion("v2");
        req.setSendTime(System.currentTimeMillis());
        req.setRows(List.of(
                new CalibrationRowDto("WB1", 0.0, null, 0.0, null, 0.0, null),
                new CalibrationRowDto("WB1", 10.0, null, 0.0, null, 4.0, null)));

        Result result = calibrationController.receiveSnapshot(req);
        CalibrationLoadResp resp = (CalibrationLoadResp) result.getData();
        assertEquals("snapshot:v2", resp.getSource());
        assertEquals(2, resp.getPointsLoaded());

        assertEquals(List.of("WB1"), calibrationStore.listTanks());
        assertEquals(2.0, readingPipeline.compute(sounding("WB1", 0.0, 5.0, null)).getBaseVolumeM3(), EPS);
        assertThrows(NoBaseVolumeException.class,
                () -> readingPipeline.compute(sounding("FO1P", 0.0, 100.0, null)));
    }
}
