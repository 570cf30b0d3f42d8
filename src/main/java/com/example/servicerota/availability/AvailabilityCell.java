package com.example.servicerota.availability;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 出欠表の1セル。行・列の位置は登録時の並びを保持
 */
@Entity
@Table(name = "availability_cells")
public class AvailabilityCell {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "person_name", nullable = false, length = 100)
    private String personName;

    @Column(name = "row_index", nullable = false)
    private Integer rowIndex;

    @Column(name = "date_label", nullable = false, length = 50)
    private String dateLabel;

    @Column(name = "date_index", nullable = false)
    private Integer dateIndex;

    @Column(nullable = false)
    private Boolean available = false;

    protected AvailabilityCell() {
    }

    public AvailabilityCell(String personName, int rowIndex, String dateLabel, int dateIndex, boolean available) {
        this.personName = personName;
        this.rowIndex = rowIndex;
        this.dateLabel = dateLabel;
        this.dateIndex = dateIndex;
        this.available = available;
    }

    public Long getId() { return id; }
    public String getPersonName() { return personName; }
    public Integer getRowIndex() { return rowIndex; }
    public String getDateLabel() { return dateLabel; }
    public Integer getDateIndex() { return dateIndex; }
    public Boolean getAvailable() { return available; }
}
