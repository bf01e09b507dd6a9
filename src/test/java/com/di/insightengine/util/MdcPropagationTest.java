package com.di.insightengine.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Tick id set on the submitting thread is visible in pool workers")
    void testPropagatesToWorkers() throws Exception {
        ExecutorService pool = MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(2));
        try {
            MDC.put(MdcPropagation.TICK_ID, "tick-7");
            List<Callable<String>> tasks = List.of(
                    () -> MDC.get(MdcPropagation.TICK_ID),
                    () -> MDC.get(MdcPropagation.TICK_ID));
            List<Future<String>> futures = pool.invokeAll(tasks, 5, TimeUnit.SECONDS);
            for (Future<String> f : futures) {
                assertEquals("tick-7", f.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Context is removed again after the task")
    void testRunWithMdcContextCleansUp() {
        String[] seen = new String[1];
        MdcPropagation.runWithMdcContext(Map.of(MdcPropagation.TICK_ID, "tick-1"),
                () -> seen[0] = MDC.get(MdcPropagation.TICK_ID));

        assertEquals("tick-1", seen[0]);
        assertNull(MDC.get(MdcPropagation.TICK_ID));
        assertTrue(MdcPropagation.copyMdc().isEmpty());
    }

    @Test
    @DisplayName("Wrapped callable captures the context at wrap time")
    void testWrapCallable() throws Exception {
        MDC.put(MdcPropagation.TICK_ID, "tick-2");
        Callable<String> wrapped = MdcPropagation.wrapCallable(() -> MDC.get(MdcPropagation.TICK_ID));
        MDC.clear();

        assertEquals("tick-2", wrapped.call());
        assertNull(MDC.get(MdcPropagation.TICK_ID));
    }
}
