package com.sigi.indicators.repository;

import com.sigi.indicators.entity.Municipality;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface MunicipalityRepository extends JpaRepository<Municipality, Long> {

    // Null-safe on the tender fields: an absent edital only matches another absent edital
    @Query("""
        SELECT COUNT(m) FROM Municipality m
        WHERE m.name = :name
          AND m.stateCode = :stateCode
          AND ((:tenderId IS NULL AND m.tenderId IS NULL) OR m.tenderId = :tenderId)
          AND ((:tenderYear IS NULL AND m.tenderYear IS NULL) OR m.tenderYear = :tenderYear)
    """)
    long countIndicatorSets(@Param("name") String name,
                            @Param("stateCode") String stateCode,
                            @Param("tenderId") String tenderId,
                            @Param("tenderYear") Integer tenderYear);

    // Absent filters are skipped, supplied ones are ANDed
    @Query("""
        SELECT m FROM Municipality m
        WHERE (:name IS NULL OR m.name = :name)
          AND (:stateCode IS NULL OR m.stateCode = :stateCode)
          AND (:tenderId IS NULL OR m.tenderId = :tenderId)
          AND (:tenderYear IS NULL OR m.tenderYear = :tenderYear)
        ORDER BY m.id
    """)
    List<Municipality> search(@Param("name") String name,
                              @Param("stateCode") String stateCode,
                              @Param("tenderId") String tenderId,
                              @Param("tenderYear") Integer tenderYear);

    Optional<Municipality> findFirstByNameContainingIgnoreCaseOrderByIdAsc(String fragment);

    List<Municipality> findAllByOrderByIdAsc();
}
