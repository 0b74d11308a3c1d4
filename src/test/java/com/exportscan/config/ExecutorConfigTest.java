package com.exportscan.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "app.executor.matching-threads=2")
@ContextConfiguration(classes = {ExecutorConfig.class})
class ExecutorConfigTest {

    @Autowired
    @Qualifier("matchingExecutor")
    private ExecutorService matchingExecutor;

    private static final String TRACE_ID = "traceId";
    private static final String RUN_ID = "runId";

    @BeforeEach
    void setUp() {
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void shouldPropagateMdcWithExecute() throws Exception {
        final String traceIdValue = UUID.randomUUID().toString();
        final CountDownLatch latch = new CountDownLatch(1);
        final CompletableFuture<String> mdcValueFuture = new CompletableFuture<>();

        MDC.put(TRACE_ID, traceIdValue);

        matchingExecutor.execute(() -> {
            try {
                mdcValueFuture.complete(MDC.get(TRACE_ID));
            } finally {
                latch.countDown();
            }
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        MDC.remove(TRACE_ID);

        assertThat(mdcValueFuture).isCompletedWithValue(traceIdValue);
        assertThat(MDC.get(TRACE_ID)).isNull();
    }

    @Test
    void shouldPropagateRunIdToCompletableFutureTasks() throws Exception {
        final String runIdValue = UUID.randomUUID().toString();
        MDC.put(RUN_ID, runIdValue);

        String seen = CompletableFuture.supplyAsync(() -> MDC.get(RUN_ID), matchingExecutor)
                .get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo(runIdValue);
    }

    @Test
    void shouldPropagateMdcWithInvokeAll() throws Exception {
        final String traceIdValue = UUID.randomUUID().toString();
        MDC.put(TRACE_ID, traceIdValue);

        List<Callable<String>> tasks = IntStream.range(0, 5)
                .mapToObj(i -> (Callable<String>) () -> MDC.get(TRACE_ID))
                .collect(Collectors.toList());

        List<Future<String>> futures = matchingExecutor.invokeAll(tasks, 5, TimeUnit.SECONDS);
        MDC.remove(TRACE_ID);

        for (Future<String> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(traceIdValue);
        }
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        MdcAwareExecutorService executor = new MdcAwareExecutorService(single);
        try {
            MDC.put(TRACE_ID, "caller");
            executor.submit(() -> MDC.get(TRACE_ID)).get(5, TimeUnit.SECONDS);
            MDC.clear();

            // same worker thread, submitted without context
            String leftover = single.submit(() -> MDC.get(TRACE_ID)).get(5, TimeUnit.SECONDS);
            String fromEmptyCaller = executor.submit(() -> MDC.get(TRACE_ID)).get(5, TimeUnit.SECONDS);

            assertThat(leftover).isNull();
            assertThat(fromEmptyCaller).isNull();
        } finally {
            executor.shutdownNow();
        }
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(executor.isShutdown()).isTrue();
    }
}
