package com.siteaudit.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AuditConfig {

    @Bean(name = "auditExecutor", destroyMethod = "shutdown")
    public ExecutorService auditExecutor(AuditProperties properties) {
        int size = properties.getScan().getAuditConcurrency() * properties.getScan().getPageParallelism();
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "pageExecutor", destroyMethod = "shutdown")
    public ExecutorService pageExecutor(AuditProperties properties) {
        int size = properties.getScan().getPageParallelism() * properties.getScan().getConcurrentScans();
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(AuditProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "scanRunExecutor", destroyMethod = "shutdown")
    public ExecutorService scanRunExecutor(AuditProperties properties) {
        return Executors.newFixedThreadPool(properties.getScan().getConcurrentScans());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
