package com.example.servicerota.qualification;

import com.example.servicerota.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/qualifications")
public class QualificationController {

    private final QualificationService qualificationService;

    public QualificationController(QualificationService qualificationService) {
        this.qualificationService = qualificationService;
    }

    @GetMapping("")
    public ResponseEntity<ApiResponse<Map<String, List<String>>>> list() {
        return ResponseEntity.ok(ApiResponse.success("qualifications", qualificationService.pools()));
    }

    /**
     * 指定プールの資格表を登録（置き換え）
     */
    @PutMapping("/{poolKey}")
    public ResponseEntity<ApiResponse<List<String>>> replace(@PathVariable("poolKey") String poolKey,
                                                             @RequestBody QualificationTableRequest request) {
        List<String> people = qualificationService.replacePool(poolKey, request.rows());
        return ResponseEntity.ok(ApiResponse.success("資格表を登録しました", people,
                Map.of("poolKey", poolKey, "count", people.size())));
    }

    public record QualificationTableRequest(List<Map<String, String>> rows) {
    }
}
