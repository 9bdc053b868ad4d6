/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.toolscope.agent.impl;

import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.toolscope.agent.impl.ExecutionContextHolder.Holder;
import org.toolscope.agent.model.Span;
import org.toolscope.common.model.ErrorDetails;
import org.toolscope.common.model.TraceStatus;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Wraps tool invocations so that each one is traced, counted, timed and logged.
 * <p>
 * A call made with no execution context starts its own trace ({@code tool_call_<tool>}) and ends
 * it when it completes. A call made inside another instrumented call joins the caller's trace, and
 * its span ({@code call_<tool>}) is a child of the caller's span. Failures are recorded and then
 * rethrown unchanged.
 */
public class ToolInstrumentation {

    private static final Logger logger = LoggerFactory.getLogger(ToolInstrumentation.class);

    private final ServerLogger serverLogger;
    private final MetricsCollector metricsCollector;
    private final Tracer tracer;
    private final Ticker ticker;
    private final TimeLimiter timeLimiter;

    private final ExecutionContextHolder contextHolder = new ExecutionContextHolder();

    public ToolInstrumentation(ServerLogger serverLogger, MetricsCollector metricsCollector,
            Tracer tracer, Ticker ticker, TimeLimiter timeLimiter) {
        this.serverLogger = serverLogger;
        this.metricsCollector = metricsCollector;
        this.tracer = tracer;
        this.ticker = ticker;
        this.timeLimiter = timeLimiter;
    }

    public <I, O> Tool<I, O> instrument(final String toolName, final Tool<I, O> tool) {
        return new Tool<I, O>() {
            @Override
            public O call(final @Nullable I input) throws Exception {
                return execute(toolName, new Callable<O>() {
                    @Override
                    public O call() throws Exception {
                        return tool.call(input);
                    }
                });
            }
        };
    }

    public <T> T execute(String toolName, Callable<T> callable) throws Exception {
        return execute(contextHolder.get(), toolName, callable);
    }

    // parent null means the call is not part of any trace yet
    public <T> T execute(@Nullable ExecutionContext parent, final String toolName,
            final Callable<T> callable) throws Exception {
        String traceId;
        if (parent == null) {
            traceId = tracer.startTrace("tool_call_" + toolName);
        } else {
            traceId = parent.traceId();
        }
        final String requestId = traceId;
        final Holder holder = contextHolder.getHolder();
        final ExecutionContext previous = holder.get();
        T result;
        try {
            result = tracer.inSpan(traceId, "call_" + toolName, toolName,
                    parent == null ? null : parent.spanId(), ImmutableMap.<String, String>of(),
                    new SpanCallback<T, Exception>() {
                        @Override
                        public T call(Span span) throws Exception {
                            holder.set(ExecutionContext.of(requestId, span.getSpanId()));
                            try {
                                return invoke(toolName, requestId, callable);
                            } finally {
                                holder.set(previous);
                            }
                        }
                    });
        } catch (Throwable t) {
            if (parent == null) {
                tracer.endTrace(traceId, TraceStatus.ERROR);
            }
            throw t;
        }
        if (parent == null) {
            tracer.endTrace(traceId, TraceStatus.SUCCESS);
        }
        return result;
    }

    /**
     * Same as {@link #execute(String, Callable)}, except that the call runs on the time limiter's
     * executor and is cancelled (interrupted) once the timeout elapses. A timeout is recorded and
     * thrown as a {@link java.util.concurrent.TimeoutException}.
     */
    public <T> T executeWithDeadline(String toolName, final long timeout, final TimeUnit unit,
            final Callable<T> callable) throws Exception {
        return execute(toolName, new Callable<T>() {
            @Override
            public T call() throws Exception {
                // wrapped here so that instrumented calls made by the tool join this span
                return callWithTimeout(wrap(callable), timeout, unit);
            }
        });
    }

    // binds the context current at wrap time, for handing work to another thread
    public <T> Callable<T> wrap(final Callable<T> callable) {
        final ExecutionContext context = contextHolder.get();
        return new Callable<T>() {
            @Override
            public T call() throws Exception {
                Holder holder = contextHolder.getHolder();
                ExecutionContext previous = holder.get();
                holder.set(context);
                try {
                    return callable.call();
                } finally {
                    holder.set(previous);
                }
            }
        };
    }

    public Runnable wrap(final Runnable runnable) {
        final ExecutionContext context = contextHolder.get();
        return new Runnable() {
            @Override
            public void run() {
                Holder holder = contextHolder.getHolder();
                ExecutionContext previous = holder.get();
                holder.set(context);
                try {
                    runnable.run();
                } finally {
                    holder.set(previous);
                }
            }
        };
    }

    public @Nullable ExecutionContext getCurrentContext() {
        return contextHolder.get();
    }

    private <T> T invoke(String toolName, String requestId, Callable<T> callable)
            throws Exception {
        serverLogger.info("Starting tool: " + toolName, LogRequest.builder()
                .toolName(toolName)
                .requestId(requestId)
                .build());
        metricsCollector.incrementCounter("tool_" + toolName + "_calls", toolName);
        Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        T result;
        try {
            result = callable.call();
        } catch (Throwable t) {
            double durationMillis = elapsedMillis(stopwatch);
            metricsCollector.incrementCounter("tool_" + toolName + "_errors", toolName);
            serverLogger.error(String.format(Locale.ENGLISH, "Tool %s failed after %.1fms: %s",
                    toolName, durationMillis, t.getMessage()), LogRequest.builder()
                            .toolName(toolName)
                            .requestId(requestId)
                            .durationMillis(durationMillis)
                            .errorDetails(ErrorDetails.from(t))
                            .build());
            logger.debug("tool {} failed", toolName, t);
            throw t;
        }
        double durationMillis = elapsedMillis(stopwatch);
        metricsCollector.recordTimer("tool_" + toolName + "_duration", durationMillis, toolName);
        serverLogger.info(String.format(Locale.ENGLISH, "Tool %s completed successfully in %.1fms",
                toolName, durationMillis), LogRequest.builder()
                        .toolName(toolName)
                        .requestId(requestId)
                        .durationMillis(durationMillis)
                        .build());
        return result;
    }

    private <T> T callWithTimeout(Callable<T> callable, long timeout, TimeUnit unit)
            throws Exception {
        try {
            return timeLimiter.callWithTimeout(callable, timeout, unit);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (UncheckedExecutionException e) {
            throw unwrap(e);
        } catch (ExecutionError e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    // the time limiter wraps whatever the tool threw, the tool's own exception is what gets
    // recorded and rethrown
    private static Exception unwrap(Exception e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        return e;
    }

    private static double elapsedMillis(Stopwatch stopwatch) {
        return stopwatch.elapsed(NANOSECONDS) / 1000000.0;
    }
}
