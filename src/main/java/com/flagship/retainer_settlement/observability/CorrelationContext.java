package com.flagship.retainer_settlement.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MDC keys used across the service, and the rules for the request correlation ID.
 *
 * The correlation ID arrives in (or is generated for) each HTTP request, is echoed back, and
 * travels with every outbox event the request writes, down to the Kafka record header.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CALLER_MDC_KEY = "caller";
    public static final String DEAL_ID_MDC_KEY = "dealId";
    public static final String INVOICE_ID_MDC_KEY = "invoiceId";

    // Anything else is replaced, so a client cannot inject text into log lines.
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private CorrelationContext() {
        // Utility class
    }

    /**
     * @return {@code incoming} if it is an acceptable ID, otherwise a newly generated one
     */
    public static String resolve(String incoming) {
        if (incoming != null && ACCEPTED_ID.matcher(incoming.trim()).matches()) {
            return incoming.trim();
        }
        return generate();
    }

    /**
     * The correlation ID of the request served by this thread. Empty on scheduler threads.
     */
    public static Optional<String> current() {
        return Optional.ofNullable(MDC.get(CORRELATION_ID_MDC_KEY));
    }

    static String generate() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
