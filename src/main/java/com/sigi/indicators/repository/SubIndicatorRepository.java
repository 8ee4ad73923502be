package com.sigi.indicators.repository;

import com.sigi.indicators.entity.SubIndicator;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubIndicatorRepository extends JpaRepository<SubIndicator, Long> {
}
