package com.example.servicerota.qualification;

import com.example.servicerota.config.RotaSettings;
import com.example.servicerota.exception.BusinessException;
import com.example.servicerota.role.RoleCatalog;
import com.example.servicerota.role.RoleDefinitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class QualificationService {
    private static final Logger logger = LoggerFactory.getLogger(QualificationService.class);

    private final QualificationEntryRepository entryRepository;
    private final RoleDefinitions roleDefinitions;
    private final RotaSettings settings;

    public QualificationService(QualificationEntryRepository entryRepository,
                                RoleDefinitions roleDefinitions,
                                RotaSettings settings) {
        this.entryRepository = entryRepository;
        this.roleDefinitions = roleDefinitions;
        this.settings = settings;
    }

    /**
     * 指定プールの資格表を置き換える。氏名は設定された列（大文字小文字を区別しない）から読み取り、
     * 列が無い行は無視する
     */
    @Transactional
    public List<String> replacePool(String poolKey, List<Map<String, String>> rows) {
        if (poolKey == null || !roleDefinitions.poolKeys().contains(poolKey)) {
            throw new BusinessException("UNKNOWN_POOL", "未定義の資格プールです: " + poolKey, poolKey);
        }
        String column = settings.getQualificationNameColumn();
        Set<String> people = new LinkedHashSet<>();
        int missingColumn = 0;
        if (rows != null) {
            for (Map<String, String> row : rows) {
                String name = valueOf(row, column);
                if (name == null) {
                    missingColumn++;
                    continue;
                }
                if (!name.isBlank()) people.add(name.trim());
            }
        }
        if (missingColumn > 0) {
            logger.warn("Pool {}: {} row(s) without a '{}' column were skipped", poolKey, missingColumn, column);
        }

        entryRepository.deleteByPoolKey(poolKey);
        entryRepository.flush();
        List<QualificationEntry> entries = new ArrayList<>(people.size());
        int position = 0;
        for (String person : people) {
            entries.add(new QualificationEntry(poolKey, person, position++));
        }
        entryRepository.saveAll(entries);
        logger.info("Stored qualification pool {} with {} people", poolKey, entries.size());
        return List.copyOf(people);
    }

    /**
     * 全プールを役割の優先順で取得。未登録のプールは空リスト
     */
    @Transactional(readOnly = true)
    public Map<String, List<String>> pools() {
        Map<String, List<String>> pools = new LinkedHashMap<>();
        roleDefinitions.poolKeys().forEach(key -> pools.put(key, new ArrayList<>()));
        for (QualificationEntry entry : entryRepository.findAllByOrderByPoolKeyAscPositionAsc()) {
            List<String> members = pools.get(entry.getPoolKey());
            if (members == null) {
                logger.debug("Ignoring entry for unused pool {}", entry.getPoolKey());
                continue;
            }
            members.add(entry.getPersonName());
        }
        return pools;
    }

    @Transactional(readOnly = true)
    public RoleCatalog loadCatalog() {
        return new RoleCatalog(roleDefinitions, pools());
    }

    private static String valueOf(Map<String, String> row, String column) {
        if (row == null) return null;
        if (row.containsKey(column)) return row.get(column) == null ? "" : row.get(column);
        for (Map.Entry<String, String> e : row.entrySet()) {
            if (e.getKey() != null && e.getKey().trim().equalsIgnoreCase(column)) {
                return e.getValue() == null ? "" : e.getValue();
            }
        }
        return null;
    }
}
