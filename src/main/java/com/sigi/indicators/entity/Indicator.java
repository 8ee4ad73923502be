package com.sigi.indicators.entity;

import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "indicators")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"municipality", "formula", "subIndicators", "conditions"})
@ToString(exclude = {"municipality", "formula", "subIndicators", "conditions"})
public class Indicator {

    public static final int NAME_LENGTH = 1000;
    public static final int DESCRIPTION_LENGTH = 8000;
    public static final int UNIT_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "municipality_id", nullable = false)
    private Municipality municipality;

    @Column(nullable = false, length = NAME_LENGTH)
    private String name;

    @Column(length = DESCRIPTION_LENGTH)
    private String description;

    @Column(length = UNIT_LENGTH)
    private String unit;               // '%', 'h', 'pontos'

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags")
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "observations")
    @Builder.Default
    private List<String> observations = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "inconsistencies")
    @Builder.Default
    private List<String> inconsistencies = new ArrayList<>();

    // Foreign key lives on formulas.indicator_id
    @OneToOne(mappedBy = "indicator", cascade = CascadeType.ALL, orphanRemoval = true)
    private Formula formula;

    @OneToMany(mappedBy = "indicator", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<SubIndicator> subIndicators = new ArrayList<>();

    @OneToMany(mappedBy = "indicator", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<Condition> conditions = new ArrayList<>();

    public void attachFormula(Formula formula) {
        formula.setIndicator(this);
        this.formula = formula;
    }

    public void addSubIndicator(SubIndicator subIndicator) {
        subIndicator.setIndicator(this);
        subIndicators.add(subIndicator);
    }

    public void addCondition(Condition condition) {
        condition.setIndicator(this);
        conditions.add(condition);
    }
}
