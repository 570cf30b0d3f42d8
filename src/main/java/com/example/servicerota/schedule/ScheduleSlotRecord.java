package com.example.servicerota.schedule;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * 保存済みスケジュールの1セル。未割当の場合 {@code personName} は null
 */
@Entity
@Table(name = "schedule_slots")
public class ScheduleSlotRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "role_name", nullable = false, length = 50)
    private String roleName;

    @Column(name = "role_position", nullable = false)
    private Integer rolePosition;

    @Column(name = "date_label", nullable = false, length = 50)
    private String dateLabel;

    @Column(name = "date_index", nullable = false)
    private Integer dateIndex;

    @Column(name = "person_name", length = 100)
    private String personName;

    @Column(name = "saved_at")
    private LocalDateTime savedAt;

    protected ScheduleSlotRecord() {
    }

    public ScheduleSlotRecord(String roleName, int rolePosition, String dateLabel, int dateIndex, String personName) {
        this.roleName = roleName;
        this.rolePosition = rolePosition;
        this.dateLabel = dateLabel;
        this.dateIndex = dateIndex;
        this.personName = personName;
    }

    @PrePersist
    protected void onCreate() {
        if (savedAt == null) {
            savedAt = LocalDateTime.now();
        }
    }

    public Long getId() { return id; }
    public String getRoleName() { return roleName; }
    public Integer getRolePosition() { return rolePosition; }
    public String getDateLabel() { return dateLabel; }
    public Integer getDateIndex() { return dateIndex; }
    public String getPersonName() { return personName; }
    public LocalDateTime getSavedAt() { return savedAt; }
}
