package com.example.servicerota.availability;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AvailabilityColumnRepository extends JpaRepository<AvailabilityColumn, Long> {

    /**
     * 見出し列を表の並び順で取得
     */
    List<AvailabilityColumn> findAllByOrderByPositionAsc();
}
