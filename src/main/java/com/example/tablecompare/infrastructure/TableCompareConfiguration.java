package com.example.tablecompare.infrastructure;

import com.example.tablecompare.domain.Delimiter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TableCompareConfiguration {
    private static final Logger log = LogManager.getLogger(TableCompareConfiguration.class);

    @Bean
    public Delimiter delimiter(@Value("${table-compare.delimiter:,}") String value) {
        Delimiter delimiter = new Delimiter(value);
        log.info("Using field delimiter '{}'", delimiter);
        return delimiter;
    }
}
