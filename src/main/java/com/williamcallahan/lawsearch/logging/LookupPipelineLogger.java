package com.williamcallahan.lawsearch.logging;

import com.williamcallahan.lawsearch.domain.norm.LawDocument;
import com.williamcallahan.lawsearch.domain.search.LookupErrorResponse;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs each step of a law lookup: facade call, document loading and markup parsing.
 * Steps running inside one facade call share its lookup id.
 */
@Aspect
@Component
public class LookupPipelineLogger {
    private static final Logger LOOKUP_LOG = LoggerFactory.getLogger("LOOKUP");

    private static final AtomicLong LOOKUP_SEQUENCE = new AtomicLong();
    private static final ThreadLocal<String> LOOKUP_ID = new ThreadLocal<>();
    private static final String NO_LOOKUP = "-";

    /**
     * Log facade operations and assign the lookup id.
     */
    @Around("execution(public * com.williamcallahan.lawsearch.service.LawLookupService.*(..))")
    public Object logLookup(ProceedingJoinPoint joinPoint) throws Throwable {
        boolean outermost = LOOKUP_ID.get() == null;
        if (outermost) {
            LOOKUP_ID.set("LKP-" + LOOKUP_SEQUENCE.incrementAndGet());
        }
        String lookupId = LOOKUP_ID.get();
        String operation = joinPoint.getSignature().getName();
        long startTime = System.currentTimeMillis();

        LOOKUP_LOG.info("[{}] LOOKUP {} - Starting", lookupId, operation);
        LOOKUP_LOG.debug("[{}] Arguments: {}", lookupId, joinPoint.getArgs());

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            if (result instanceof LookupErrorResponse error) {
                LOOKUP_LOG.info("[{}] LOOKUP {} - No result in {}ms: {}", lookupId, operation, duration, error.error());
            } else {
                LOOKUP_LOG.info("[{}] LOOKUP {} - Completed in {}ms", lookupId, operation, duration);
            }
            return result;
        } catch (RuntimeException e) {
            LOOKUP_LOG.error("[{}] LOOKUP {} - Failed: {}", lookupId, operation, e.getMessage());
            throw e;
        } finally {
            if (outermost) {
                LOOKUP_ID.remove();
            }
        }
    }

    /**
     * Log document loading
     */
    @Around("execution(* com.williamcallahan.lawsearch.service.LawDocumentLoader+.load(..)) && args(lawCode)")
    public Object logDocumentLoading(ProceedingJoinPoint joinPoint, String lawCode) throws Throwable {
        String lookupId = currentLookupId();
        long startTime = System.currentTimeMillis();

        LOOKUP_LOG.info("[{}] DOCUMENT LOADING {} - Starting", lookupId, lawCode);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            boolean loaded = result instanceof Optional<?> document && document.isPresent();
            LOOKUP_LOG.info("[{}] DOCUMENT LOADING {} - {} in {}ms",
                lookupId, lawCode, loaded ? "Loaded" : "Not found", duration);
            return result;
        } catch (RuntimeException e) {
            LOOKUP_LOG.error("[{}] DOCUMENT LOADING {} - Failed: {}", lookupId, lawCode, e.getMessage());
            throw e;
        }
    }

    /**
     * Log markup parsing
     */
    @Around("execution(* com.williamcallahan.lawsearch.service.markup.LawMarkupParser.parse(..))")
    public Object logMarkupParsing(ProceedingJoinPoint joinPoint) throws Throwable {
        String lookupId = currentLookupId();
        long startTime = System.currentTimeMillis();

        LOOKUP_LOG.debug("[{}] MARKUP PARSING - Starting", lookupId);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            if (result instanceof LawDocument document) {
                LOOKUP_LOG.info("[{}] MARKUP PARSING - {} norms ({} paragraphs) in {}ms",
                    lookupId, document.norms().size(), document.paragraphs().size(), duration);
            }
            return result;
        } catch (Exception e) {
            LOOKUP_LOG.error("[{}] MARKUP PARSING - Failed: {}", lookupId, e.getMessage());
            throw e;
        }
    }

    private static String currentLookupId() {
        String lookupId = LOOKUP_ID.get();
        return lookupId == null ? NO_LOOKUP : lookupId;
    }
}
