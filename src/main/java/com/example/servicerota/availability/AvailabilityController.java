package com.example.servicerota.availability;

import com.example.servicerota.common.ApiResponse;
import com.example.servicerota.common.error.ErrorLogBuffer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/availability")
public class AvailabilityController {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityController.class);

    private final AvailabilityService availabilityService;
    private final AvailabilityCsvReader csvReader;
    private final ErrorLogBuffer errorLogBuffer;

    public AvailabilityController(AvailabilityService availabilityService,
                                  AvailabilityCsvReader csvReader,
                                  ErrorLogBuffer errorLogBuffer) {
        this.availabilityService = availabilityService;
        this.csvReader = csvReader;
        this.errorLogBuffer = errorLogBuffer;
    }

    /**
     * 出欠表を登録（置き換え）
     */
    @PutMapping("")
    public ResponseEntity<ApiResponse<AvailabilityTableDto>> replace(@Valid @RequestBody AvailabilityTableDto request) {
        AvailabilityTable table = AvailabilityTable.parse(request.header(), request.rows());
        availabilityService.replace(table);
        return ResponseEntity.ok(ApiResponse.success("出欠表を登録しました", AvailabilityTableDto.from(table), meta(table)));
    }

    /**
     * CSVファイルから出欠表を取り込む
     */
    @PostMapping("/csv")
    public ResponseEntity<ApiResponse<AvailabilityTableDto>> importCsv(@RequestParam("file") MultipartFile file) {
        try (InputStream in = file.getInputStream()) {
            AvailabilityTable table = csvReader.read(in);
            availabilityService.replace(table);
            return ResponseEntity.ok(ApiResponse.success("CSVを取り込みました", AvailabilityTableDto.from(table), meta(table)));
        } catch (IOException e) {
            logger.error("Failed to read availability CSV {}", file.getOriginalFilename(), e);
            errorLogBuffer.addError("/api/availability/csv failed", e);
            return ResponseEntity.internalServerError().body(ApiResponse.failure("CSVの読み込みに失敗しました"));
        }
    }

    @GetMapping("")
    public ResponseEntity<ApiResponse<AvailabilityTableDto>> get() {
        Optional<AvailabilityTable> table = availabilityService.load();
        if (table.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("出欠表が登録されていません"));
        }
        return ResponseEntity.ok(ApiResponse.success(null, AvailabilityTableDto.from(table.get()), meta(table.get())));
    }

    /**
     * 日付・役割ごとの充足状況
     */
    @GetMapping("/coverage")
    public ResponseEntity<ApiResponse<CoverageReport>> coverage() {
        CoverageReport report = availabilityService.coverage();
        return ResponseEntity.ok(ApiResponse.success("coverage", report, Map.of("issues", report.issueCount())));
    }

    /**
     * 指定メンバーの出欠カレンダー
     */
    @GetMapping("/members/{person}")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> calendar(@PathVariable("person") String person) {
        Map<String, Boolean> calendar = availabilityService.require().calendarOf(person);
        if (calendar.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("メンバーが見つかりません"));
        }
        return ResponseEntity.ok(ApiResponse.success(person, calendar));
    }

    private static Map<String, Object> meta(AvailabilityTable table) {
        return Map.of("people", table.people().size(), "dates", table.dates().size());
    }

    public record AvailabilityTableDto(@NotEmpty List<String> header, List<List<String>> rows) {
        static AvailabilityTableDto from(AvailabilityTable table) {
            return new AvailabilityTableDto(table.header(), table.toRows());
        }
    }
}
