package com.eduhub.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Scope-bound carrier of the current {@link TenantContext}.
 *
 * A context is bound for the duration of a scope and restored to the
 * previous binding when the scope ends, so nested scopes compose and no
 * binding outlives the unit of work that opened it. Outside any scope,
 * {@link #current()} is empty and {@link #require()} fails.
 *
 * The binding follows the logical unit of work, not the physical thread:
 * work handed to another thread must be wrapped with
 * {@code wrapRunnable}, {@code wrapCallable} or {@code wrapSupplier} (or run on
 * an executor decorated with {@link TenantContextTaskDecorator}), which
 * capture the binding at hand-off and rebind it on the worker for the
 * duration of the task.
 *
 * Usage:
 * <pre>
 * try (TenantContextHolder.Scope scope = TenantContextHolder.open(context)) {
 *     studentService.create(student);
 * }
 *
 * // or
 * TenantContextHolder.runWith(context, () -&gt; studentService.create(student));
 *
 * // hand-off to another worker
 * CompletableFuture&lt;Report&gt; report =
 *     TenantContextHolder.supplyAsync(() -&gt; reportService.build(), executor);
 * </pre>
 */
public final class TenantContextHolder {
    
    private static final Logger log = LoggerFactory.getLogger(TenantContextHolder.class);
    
    private static final ThreadLocal<TenantContext> CURRENT = new ThreadLocal<>();
    
    private TenantContextHolder() {
        throw new UnsupportedOperationException("TenantContextHolder is a utility class and cannot be instantiated");
    }
    
    /**
     * @return the context bound to the current unit of work, or empty outside any scope
     */
    public static Optional<TenantContext> current() {
        return Optional.ofNullable(CURRENT.get());
    }
    
    /**
     * @return the bound context
     * @throws NoTenantContextException if no context is bound
     */
    public static TenantContext require() {
        TenantContext context = CURRENT.get();
        if (context == null) {
            throw new NoTenantContextException();
        }
        return context;
    }
    
    /**
     * @return the tenant id of the bound context
     * @throws NoTenantContextException if no context is bound
     */
    public static String requireTenantId() {
        return require().getTenantId();
    }
    
    /**
     * Bind a context until the returned scope is closed.
     *
     * @param context the context to bind, must not be null
     * @return a scope that restores the previous binding on close
     */
    public static Scope open(TenantContext context) {
        if (context == null) {
            throw new IllegalArgumentException("Tenant context must not be null");
        }
        return bind(context);
    }
    
    /**
     * Run work with a context bound.
     */
    public static void runWith(TenantContext context, Runnable work) {
        try (Scope ignored = open(context)) {
            work.run();
        }
    }
    
    /**
     * Call work with a context bound and return its result.
     */
    public static <T> T callWith(TenantContext context, Callable<T> work) throws Exception {
        try (Scope ignored = open(context)) {
            return work.call();
        }
    }
    
    /**
     * Capture the current binding for a task that runs elsewhere.
     *
     * The task runs with exactly the captured binding, or with none if
     * nothing was bound at capture time, whatever the worker had bound before.
     */
    public static Runnable wrapRunnable(Runnable task) {
        TenantContext captured = CURRENT.get();
        return () -> {
            try (Scope ignored = bind(captured)) {
                task.run();
            }
        };
    }
    
    /**
     * Capture the current binding for a callable that runs elsewhere.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        TenantContext captured = CURRENT.get();
        return () -> {
            try (Scope ignored = bind(captured)) {
                return task.call();
            }
        };
    }
    
    /**
     * Capture the current binding for a supplier that runs elsewhere.
     */
    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        TenantContext captured = CURRENT.get();
        return () -> {
            try (Scope ignored = bind(captured)) {
                return task.get();
            }
        };
    }
    
    /**
     * {@link CompletableFuture#supplyAsync(Supplier, Executor)} with the
     * current binding carried to the executing worker.
     */
    public static <T> CompletableFuture<T> supplyAsync(Supplier<T> task, Executor executor) {
        return CompletableFuture.supplyAsync(wrapSupplier(task), executor);
    }
    
    private static Scope bind(TenantContext context) {
        TenantContext previous = CURRENT.get();
        set(context);
        if (context != null) {
            log.debug("Bound tenant context: {}", context.getTenantId());
        }
        return new Scope(previous, context);
    }
    
    private static void set(TenantContext context) {
        if (context == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(context);
        }
    }
    
    /**
     * A live binding. Closing it restores whatever was bound before.
     * Closing twice has no further effect.
     */
    public static final class Scope implements AutoCloseable {
        
        private final TenantContext previous;
        private final TenantContext bound;
        private boolean closed;
        
        private Scope(TenantContext previous, TenantContext bound) {
            this.previous = previous;
            this.bound = bound;
        }
        
        public TenantContext getContext() {
            return bound;
        }
        
        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (bound != null) {
                log.debug("Releasing tenant context: {}", bound.getTenantId());
            }
            set(previous);
        }
    }
}
