package com.eduhub.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.eduhub.TenantFixtures.context;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TenantContextHolder.
 *
 * Tests verify:
 * - Scoped binding and restoration
 * - Propagation to executor threads
 * - Isolation between concurrent workers
 */
@DisplayName("TenantContextHolder")
class TenantContextHolderTest {
    
    @AfterEach
    void tearDown() {
        assertThat(TenantContextHolder.current()).as("context leaked from test").isEmpty();
    }
    
    @Test
    @DisplayName("should be empty outside any scope")
    void shouldBeEmptyOutsideScope() {
        assertThat(TenantContextHolder.current()).isEmpty();
        assertThatThrownBy(TenantContextHolder::require).isInstanceOf(NoTenantContextException.class);
    }
    
    @Test
    @DisplayName("should bind context for the duration of a scope")
    void shouldBindWithinScope() {
        // Given
        TenantContext acme = context("acme");
        
        // When/Then
        try (TenantContextHolder.Scope scope = TenantContextHolder.open(acme)) {
            assertThat(TenantContextHolder.current()).contains(acme);
            assertThat(TenantContextHolder.requireTenantId()).isEqualTo("acme");
            assertThat(scope.getContext()).isEqualTo(acme);
        }
        assertThat(TenantContextHolder.current()).isEmpty();
    }
    
    @Test
    @DisplayName("should restore outer binding when nested scope closes")
    void shouldRestoreOuterBinding() {
        TenantContext outer = context("outer");
        TenantContext inner = context("inner");
        
        TenantContextHolder.runWith(outer, () -> {
            TenantContextHolder.runWith(inner, () ->
                assertThat(TenantContextHolder.requireTenantId()).isEqualTo("inner"));
            assertThat(TenantContextHolder.requireTenantId()).isEqualTo("outer");
        });
    }
    
    @Test
    @DisplayName("should release binding when work fails")
    void shouldReleaseOnFailure() {
        assertThatThrownBy(() -> TenantContextHolder.runWith(context("acme"), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        
        assertThat(TenantContextHolder.current()).isEmpty();
    }
    
    @Test
    @DisplayName("should ignore a second close of the same scope")
    void shouldCloseIdempotently() {
        TenantContextHolder.Scope outer = TenantContextHolder.open(context("outer"));
        TenantContextHolder.Scope inner = TenantContextHolder.open(context("inner"));
        
        inner.close();
        inner.close();
        
        assertThat(TenantContextHolder.requireTenantId()).isEqualTo("outer");
        outer.close();
    }
    
    @Test
    @DisplayName("should return value from callWith")
    void shouldReturnFromCallWith() throws Exception {
        String result = TenantContextHolder.callWith(context("acme"), TenantContextHolder::requireTenantId);
        
        assertThat(result).isEqualTo("acme");
    }
    
    @Test
    @DisplayName("should reject null context")
    void shouldRejectNullContext() {
        assertThatThrownBy(() -> TenantContextHolder.open(null)).isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    @DisplayName("should carry context to a plain executor through wrapCallable")
    void shouldPropagateThroughWrapCallable() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<TenantContext>> seen = TenantContextHolder.callWith(context("acme"),
                () -> executor.submit(TenantContextHolder.wrapCallable(TenantContextHolder::current)));
            
            assertThat(seen.get(5, TimeUnit.SECONDS)).map(TenantContext::getTenantId).contains("acme");
            
            // The worker thread is clean again afterwards
            Future<Optional<TenantContext>> after = executor.submit(TenantContextHolder::current);
            assertThat(after.get(5, TimeUnit.SECONDS)).isEmpty();
        } finally {
            executor.shutdownNow();
        }
    }
    
    @Test
    @DisplayName("should carry context through CompletableFuture chains")
    void shouldPropagateThroughSupplyAsync() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<String> future = TenantContextHolder.callWith(context("acme"),
                () -> TenantContextHolder.supplyAsync(TenantContextHolder::requireTenantId, executor));
            
            assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo("acme");
        } finally {
            executor.shutdownNow();
        }
    }
    
    @Test
    @DisplayName("should clear stale worker binding when wrapped task was captured without context")
    void shouldClearStaleWorkerBinding() throws Exception {
        Runnable captureless = TenantContextHolder.wrapRunnable(() ->
            assertThat(TenantContextHolder.current()).isEmpty());
        
        TenantContextHolder.runWith(context("stale"), captureless);
    }
    
    @Test
    @DisplayName("should carry context to a plain executor through wrapRunnable")
    void shouldPropagateThroughWrapRunnable() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            AtomicReference<String> seen = new AtomicReference<>();
            Runnable capture = () -> seen.set(TenantContextHolder.requireTenantId());
            Future<?> done = TenantContextHolder.callWith(context("acme"),
                () -> executor.submit(TenantContextHolder.wrapRunnable(capture)));
            
            done.get(5, TimeUnit.SECONDS);
            assertThat(seen.get()).isEqualTo("acme");
        } finally {
            executor.shutdownNow();
        }
    }
    
    @Test
    @DisplayName("should carry context through ThreadPoolTaskExecutor with the task decorator")
    void shouldPropagateThroughTaskDecorator() throws Exception {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setTaskDecorator(new TenantContextTaskDecorator());
        executor.initialize();
        try {
            Future<String> seen = TenantContextHolder.callWith(context("acme"),
                () -> executor.submit(TenantContextHolder::requireTenantId));
            
            assertThat(seen.get(5, TimeUnit.SECONDS)).isEqualTo("acme");
        } finally {
            executor.shutdown();
        }
    }
    
    @Test
    @DisplayName("should keep concurrent workers isolated from each other")
    void shouldIsolateConcurrentWorkers() throws Exception {
        // Given
        int threadCount = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger mismatches = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        
        // When
        for (int i = 0; i < threadCount; i++) {
            String tenantId = "tenant-" + i;
            futures.add(executor.submit(() -> {
                start.await();
                for (int n = 0; n < 200; n++) {
                    TenantContextHolder.runWith(context(tenantId), () -> {
                        Thread.yield();
                        if (!tenantId.equals(TenantContextHolder.requireTenantId())) {
                            mismatches.incrementAndGet();
                        }
                    });
                }
                return null;
            }));
        }
        start.countDown();
        try {
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        
        // Then
        assertThat(mismatches.get()).isZero();
    }
}
