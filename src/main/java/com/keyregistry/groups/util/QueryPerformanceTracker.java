package com.keyregistry.groups.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times registry storage calls.
 * Logs slow calls and records a timer per operation and store.
 */
@Component
public class QueryPerformanceTracker {
    
    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;
    
    private final MeterRegistry meterRegistry;
    
    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }
    
    /**
     * Run a storage call and record how long it took.
     * 
     * @param operation operation name used as a metric tag (GetItem, Query, TransactWriteItems...)
     * @param store table or store name
     * @param storageCall the call to execute
     * @return the call's result
     */
    public <T> T trackQuery(String operation, String store, Supplier<T> storageCall) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";
        
        try {
            T result = storageCall.get();
            long duration = System.currentTimeMillis() - startTime;
            
            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow registry storage call: operation={}, store={}, duration={}ms",
                    operation, store, duration);
            } else {
                logger.debug("Registry storage call completed: operation={}, store={}, duration={}ms",
                    operation, store, duration);
            }
            
            return result;
            
        } catch (RuntimeException e) {
            outcome = e.getClass().getSimpleName();
            long duration = System.currentTimeMillis() - startTime;
            logger.debug("Registry storage call ended with {}: operation={}, store={}, duration={}ms",
                outcome, operation, store, duration);
            throw e;
            
        } finally {
            sample.stop(Timer.builder("registry.storage.duration")
                .tag("operation", operation)
                .tag("store", store)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }
}
