package com.example.servicerota.schedule;

import com.example.servicerota.common.ApiResponse;
import com.example.servicerota.common.error.ErrorLogBuffer;
import com.example.servicerota.exception.BusinessException;
import com.example.servicerota.exception.ScheduleGenerationException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleService scheduleService;
    private final ScheduleCsvExporter csvExporter;
    private final ErrorLogBuffer errorLogBuffer;

    public ScheduleController(ScheduleService scheduleService,
                              ScheduleCsvExporter csvExporter,
                              ErrorLogBuffer errorLogBuffer) {
        this.scheduleService = scheduleService;
        this.csvExporter = csvExporter;
        this.errorLogBuffer = errorLogBuffer;
    }

    /**
     * スケジュール生成（保存はしない）
     */
    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<ScheduleGridDto>> generate(
            @RequestParam(name = "seed", required = false) Long seed,
            @RequestParam(name = "useHistory", required = false, defaultValue = "false") boolean useHistory) {
        try {
            GenerationResult result = scheduleService.generate(seed, useHistory);
            ScheduleGrid grid = result.grid();
            Map<String, Object> meta = new HashMap<>();
            meta.put("seed", result.seed());
            meta.put("seededFromHistory", result.seededFromHistory());
            meta.put("dates", grid.dates().size());
            meta.put("roles", grid.roles().size());
            meta.put("filled", grid.filledCount());
            meta.put("unassigned", grid.unassignedCount());
            meta.put("rolesWithEmptyPool", result.rolesWithEmptyPool());
            meta.put("fairness", result.fairness());
            return ResponseEntity.ok(ApiResponse.success("スケジュールを生成しました", ScheduleGridDto.from(grid), meta));
        } catch (ScheduleGenerationException | BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("/api/schedule/generate failed seed={} useHistory={}", seed, useHistory, e);
            errorLogBuffer.addError("/api/schedule/generate failed", e);
            return ResponseEntity.internalServerError().body(ApiResponse.failure("スケジュール生成に失敗しました"));
        }
    }

    /**
     * 確定スケジュールを保存
     */
    @PutMapping("")
    public ResponseEntity<ApiResponse<ScheduleGridDto>> save(@Valid @RequestBody ScheduleGridDto request) {
        ScheduleGrid saved = scheduleService.saveFinal(request.toGrid());
        Map<String, Object> meta = Map.of(
                "dates", saved.dates().size(),
                "filled", saved.filledCount(),
                "unassigned", saved.unassignedCount());
        return ResponseEntity.ok(ApiResponse.success("スケジュールを保存しました", ScheduleGridDto.from(saved), meta));
    }

    @GetMapping("")
    public ResponseEntity<ApiResponse<ScheduleGridDto>> get() {
        Optional<ScheduleGrid> saved = scheduleService.loadFinal();
        if (saved.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.failure("保存済みのスケジュールがありません"));
        }
        return ResponseEntity.ok(ApiResponse.success(ScheduleGridDto.from(saved.get())));
    }

    /**
     * 確定スケジュールをCSVでダウンロード
     */
    @GetMapping("/export")
    public ResponseEntity<byte[]> export() {
        ScheduleCsvExporter.CsvFile file = csvExporter.export(scheduleService.requireFinal());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.filename() + "\"")
                .contentType(new MediaType("text", "csv", java.nio.charset.StandardCharsets.UTF_8))
                .body(file.data());
    }

    /**
     * 確定スケジュールから集計した役割別担当回数
     */
    @GetMapping("/fairness")
    public ResponseEntity<ApiResponse<Map<String, Map<String, Integer>>>> fairness() {
        return ResponseEntity.ok(ApiResponse.success("fairness", scheduleService.savedFairness()));
    }
}
