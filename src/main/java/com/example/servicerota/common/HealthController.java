package com.example.servicerota.common;

import com.example.servicerota.common.error.ErrorLogBuffer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final ErrorLogBuffer errorLogBuffer;

    public HealthController(ErrorLogBuffer errorLogBuffer) {
        this.errorLogBuffer = errorLogBuffer;
    }

    @GetMapping("")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        return ResponseEntity.ok(ApiResponse.success("OK", Map.of("status", "UP")));
    }

    @GetMapping("/errors")
    public ResponseEntity<ApiResponse<List<ErrorLogBuffer.Entry>>> recentErrors() {
        List<ErrorLogBuffer.Entry> entries = errorLogBuffer.recent();
        return ResponseEntity.ok(ApiResponse.success("errors", entries, Map.of("count", entries.size())));
    }

    @DeleteMapping("/errors")
    public ResponseEntity<ApiResponse<Void>> clearErrors() {
        errorLogBuffer.clear();
        return ResponseEntity.ok(ApiResponse.success("エラーログを消去しました", null));
    }
}
