package com.example.servicerota.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

@Component
public class RotaSettings {
    private final Long tieBreakSeed;
    private final String qualificationNameColumn;
    private final int coverageLimitedThreshold;

    public RotaSettings(
            @Value("${rota.tiebreak.seed:}") String tieBreakSeed,
            @Value("${rota.qualification.name-column:name}") String qualificationNameColumn,
            @Value("${rota.coverage.limited-threshold:2}") int coverageLimitedThreshold) {
        this.tieBreakSeed = tieBreakSeed == null || tieBreakSeed.isBlank() ? null : Long.valueOf(tieBreakSeed.trim());
        this.qualificationNameColumn = qualificationNameColumn;
        this.coverageLimitedThreshold = coverageLimitedThreshold;
    }

    /**
     * タイブレーク用シード。リクエスト指定、設定値、乱数の順で決定
     */
    public long resolveSeed(Long override) {
        if (override != null) return override;
        if (tieBreakSeed != null) return tieBreakSeed;
        return ThreadLocalRandom.current().nextLong();
    }

    public String getQualificationNameColumn() { return qualificationNameColumn; }
    public int getCoverageLimitedThreshold() { return coverageLimitedThreshold; }
}
