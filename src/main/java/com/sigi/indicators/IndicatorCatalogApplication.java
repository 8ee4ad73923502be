package com.sigi.indicators;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SIGI (Sistema Inteligente de Gestão de Indicadores): stores, compares and exports
 * the indicator sets of municipal public-lighting tenders.
 *
 * <p>Endpoints are served under <code>/indicadores</code>. The database is taken from
 * the {@code DATABASE_URL} environment variable and its schema is created at startup.</p>
 */
@SpringBootApplication
public class IndicatorCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(IndicatorCatalogApplication.class, args);
    }
}
