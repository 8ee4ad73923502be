package com.sigi.indicators.repository;

import com.sigi.indicators.entity.Formula;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface FormulaRepository extends JpaRepository<Formula, Long> {

    /**
     * Formulas whose hash is shared by at least one other formula.
     * Null hashes never take part in a group.
     */
    @Query("""
        SELECT f FROM Formula f
        JOIN FETCH f.indicator i
        JOIN FETCH i.municipality
        WHERE f.hash IN (
            SELECT f2.hash FROM Formula f2
            WHERE f2.hash IS NOT NULL
            GROUP BY f2.hash
            HAVING COUNT(f2.id) > 1)
        ORDER BY f.hash, f.id
    """)
    List<Formula> findWithSharedHash();

    /**
     * Formulas whose normalized text is shared by at least one other formula.
     */
    @Query("""
        SELECT f FROM Formula f
        JOIN FETCH f.indicator i
        JOIN FETCH i.municipality
        WHERE f.normalizedText IN (
            SELECT f2.normalizedText FROM Formula f2
            WHERE f2.normalizedText IS NOT NULL
            GROUP BY f2.normalizedText
            HAVING COUNT(f2.id) > 1)
        ORDER BY f.normalizedText, f.id
    """)
    List<Formula> findWithSharedNormalizedText();
}
