package com.example.servicerota.qualification;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QualificationEntryRepository extends JpaRepository<QualificationEntry, Long> {

    /**
     * 全プールの資格者をプール別・登録順で取得
     */
    List<QualificationEntry> findAllByOrderByPoolKeyAscPositionAsc();

    /**
     * 指定プールの資格者を削除
     */
    void deleteByPoolKey(String poolKey);
}
