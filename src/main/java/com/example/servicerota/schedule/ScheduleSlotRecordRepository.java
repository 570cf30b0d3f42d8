package com.example.servicerota.schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScheduleSlotRecordRepository extends JpaRepository<ScheduleSlotRecord, Long> {

    /**
     * 保存済みスケジュールを役割順・日付順で取得
     */
    List<ScheduleSlotRecord> findAllByOrderByRolePositionAscDateIndexAsc();
}
