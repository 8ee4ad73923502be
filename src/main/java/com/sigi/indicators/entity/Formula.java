package com.sigi.indicators.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Formula of an indicator, one-to-one with its owner.
 *
 * The hash is supplied by the document producer as a stable digest of the
 * normalized text; it is stored as-is and never recomputed here.
 */
@Entity
@Table(name = "formulas")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"indicator"})
@ToString(exclude = {"indicator"})
public class Formula {

    public static final int TEXT_LENGTH = 8000;
    public static final int HASH_LENGTH = 128;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "indicator_id", nullable = false, unique = true)
    private Indicator indicator;

    @Column(name = "raw_text", length = TEXT_LENGTH)
    private String rawText;            // as published in the tender

    @Column(name = "normalized_text", length = TEXT_LENGTH)
    private String normalizedText;

    @Column(name = "formula_hash", length = HASH_LENGTH)
    private String hash;
}
