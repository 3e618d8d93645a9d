package it.berlink.dbmonitor.pool;

import it.berlink.dbmonitor.service.QueryMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entry point for wrapping an application pool with query instrumentation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PoolInstrumenter {

    private final QueryMonitor monitor;
    private final PoolStatementClassifier classifier;

    public InstrumentedPool instrument(DatabasePool pool) {
        if (pool instanceof InstrumentedPool instrumented) {
            return instrumented;
        }
        log.info("Instrumenting database pool {}", pool.getClass().getSimpleName());
        return new InstrumentedPool(pool, monitor, classifier);
    }
}
