package com.example.servicerota.availability;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AvailabilityCellRepository extends JpaRepository<AvailabilityCell, Long> {

    /**
     * 全セルを行順・日付順で取得
     */
    List<AvailabilityCell> findAllByOrderByRowIndexAscDateIndexAsc();
}
