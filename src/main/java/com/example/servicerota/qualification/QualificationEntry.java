package com.example.servicerota.qualification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(name = "qualification_entries",
        uniqueConstraints = @UniqueConstraint(columnNames = {"pool_key", "person_name"}))
public class QualificationEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pool_key", nullable = false, length = 50)
    private String poolKey;

    @Column(name = "person_name", nullable = false, length = 100)
    private String personName;

    // アップロードされた表での順番
    @Column(nullable = false)
    private Integer position;

    protected QualificationEntry() {
    }

    public QualificationEntry(String poolKey, String personName, int position) {
        this.poolKey = poolKey;
        this.personName = personName;
        this.position = position;
    }

    public Long getId() { return id; }
    public String getPoolKey() { return poolKey; }
    public String getPersonName() { return personName; }
    public Integer getPosition() { return position; }
}
