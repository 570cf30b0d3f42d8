package com.example.servicerota.availability;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 出欠表の見出し列。位置0は氏名列、1以降が日付列
 */
@Entity
@Table(name = "availability_columns")
public class AvailabilityColumn {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Integer position;

    @Column(nullable = false, length = 100)
    private String label;

    protected AvailabilityColumn() {
    }

    public AvailabilityColumn(int position, String label) {
        this.position = position;
        this.label = label;
    }

    public Long getId() { return id; }
    public Integer getPosition() { return position; }
    public String getLabel() { return label; }
}
