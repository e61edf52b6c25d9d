package com.malwa.record_store.config;

import com.malwa.record_store.schema.ErpSchema;
import com.malwa.record_store.schema.SchemaRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StoreConfig {

    @Bean
    public SchemaRegistry schemaRegistry() {
        return ErpSchema.registry();
    }

    /**
     * Clock for record timestamps and default entry dates.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
