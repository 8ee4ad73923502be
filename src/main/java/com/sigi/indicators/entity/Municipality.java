package com.sigi.indicators.entity;

import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.*;
import lombok.*;

/**
 * One imported indicator set: a municipality and the tender it was taken from.
 * The (name, stateCode, tenderId, tenderYear) tuple is kept unique by the importer,
 * not by a database constraint.
 */
@Entity
@Table(name = "municipalities")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"indicators"})
@ToString(exclude = {"indicators"})
public class Municipality {

    public static final int NAME_LENGTH = 1000;
    public static final int TENDER_ID_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = NAME_LENGTH)
    private String name;

    @Column(name = "state_code", nullable = false, length = 2)
    private String stateCode;          // 'SP', 'MG'

    @Column(name = "tender_id", length = TENDER_ID_LENGTH)
    private String tenderId;           // edital

    @Column(name = "tender_year")
    private Integer tenderYear;

    @OneToMany(mappedBy = "municipality", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<Indicator> indicators = new ArrayList<>();

    public void addIndicator(Indicator indicator) {
        indicator.setMunicipality(this);
        indicators.add(indicator);
    }
}
