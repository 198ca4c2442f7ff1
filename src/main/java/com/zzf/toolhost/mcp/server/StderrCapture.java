package com.zzf.toolhost.mcp.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * 把 stdio 子进程的 stderr 路由到所属服务器的诊断缓冲区.
 * <p>
 * The stdio transport reads a child's stderr on a thread it starts while connecting and logs
 * each line through {@link #STDERR_LOGGER}. A sink bound with {@link #bind(DiagnosticSink)}
 * is inherited by threads started during the binding, so the appender can tell which server
 * a line came from.
 */
@Slf4j
public final class StderrCapture {

    public static final String STDERR_LOGGER = "dev.langchain4j.mcp.client.transport.stdio.ProcessStderrHandler";

    static final String APPENDER_NAME = "TOOLHOST_PROVIDER_STDERR";

    private static final String LINE_PREFIX = "[ERROR] ";

    private static final InheritableThreadLocal<DiagnosticSink> BOUND = new InheritableThreadLocal<>();

    private StderrCapture() {
    }

    /**
     * Attaches the routing appender to the stderr logger. Safe to call more than once.
     */
    public static synchronized void install() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            log.warn("stderr.capture_unavailable loggerFactory={}", factory.getClass().getName());
            return;
        }
        LoggerContext ctx = (LoggerContext) factory;
        ch.qos.logback.classic.Logger stderr = ctx.getLogger(STDERR_LOGGER);
        if (stderr.getAppender(APPENDER_NAME) != null) {
            return;
        }
        RoutingAppender appender = new RoutingAppender();
        appender.setName(APPENDER_NAME);
        appender.setContext(ctx);
        appender.start();
        stderr.addAppender(appender);
        // lines are logged at debug; keep them out of the console
        stderr.setLevel(Level.DEBUG);
        stderr.setAdditive(false);
        log.info("stderr.capture_installed logger={}", STDERR_LOGGER);
    }

    /**
     * Binds {@code sink} to the current thread and every thread it starts until the returned
     * binding is closed.
     */
    public static Binding bind(DiagnosticSink sink) {
        DiagnosticSink previous = BOUND.get();
        BOUND.set(sink);
        return () -> {
            if (previous == null) {
                BOUND.remove();
            } else {
                BOUND.set(previous);
            }
        };
    }

    static void route(String message) {
        DiagnosticSink sink = BOUND.get();
        if (sink == null || message == null || message.isBlank()) {
            return;
        }
        String line = message.startsWith(LINE_PREFIX) ? message.substring(LINE_PREFIX.length()) : message;
        sink.accept("[stderr] " + line);
    }

    @FunctionalInterface
    public interface Binding extends AutoCloseable {

        @Override
        void close();
    }

    static final class RoutingAppender extends AppenderBase<ILoggingEvent> {

        @Override
        protected void append(ILoggingEvent event) {
            route(event.getFormattedMessage());
        }
    }
}
