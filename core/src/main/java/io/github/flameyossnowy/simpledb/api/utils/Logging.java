package io.github.flameyossnowy.simpledb.api.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Switchable tracing used by the query compiler and the pager.
 *
 * <p>{@link #ENABLED} turns on compiled expressions and request summaries,
 * {@link #DEEP} additionally traces every page and parameter.</p>
 */
public final class Logging {
    public static volatile boolean ENABLED = false;
    public static volatile boolean DEEP = false;

    private static final Logger LOGGER = LoggerFactory.getLogger("simpledb");

    private Logging() {}

    public static void info(Supplier<String> message) {
        if (ENABLED) LOGGER.info(message.get());
    }

    public static void deepInfo(Supplier<String> message) {
        if (ENABLED && DEEP) LOGGER.info(message.get());
    }
}
