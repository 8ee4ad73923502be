package com.sigi.indicators.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "sub_indicators")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"indicator"})
@ToString(exclude = {"indicator"})
public class SubIndicator {

    public static final int NAME_LENGTH = 1000;
    public static final int DESCRIPTION_LENGTH = 8000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "indicator_id", nullable = false)
    private Indicator indicator;

    @Column(nullable = false, length = NAME_LENGTH)
    private String name;

    @Column(length = DESCRIPTION_LENGTH)
    private String description;
}
