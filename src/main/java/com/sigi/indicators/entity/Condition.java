package com.sigi.indicators.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Scoring rule of an indicator: a threshold text and the score granted when it holds.
 */
@Entity
@Table(name = "indicator_conditions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"indicator"})
@ToString(exclude = {"indicator"})
public class Condition {

    public static final int RULE_LENGTH = 4000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "indicator_id", nullable = false)
    private Indicator indicator;

    @Column(length = RULE_LENGTH)
    private String rule;               // 'ID >= 98%'

    private Double score;
}
