package com.flagship.transaction_engine.config;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for CSV input and output.
 *
 * Key features:
 * - Whitespace around values is trimmed ("deposit, 1, 1, 1.0" is valid)
 * - Blank lines are skipped
 * - Extra trailing columns are ignored instead of failing the whole file
 */
@Configuration
public class CsvConfig {

    @Bean
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .build();
    }
}
