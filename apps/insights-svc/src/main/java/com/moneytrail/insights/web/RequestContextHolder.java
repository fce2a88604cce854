package com.moneytrail.insights.web;

import java.util.Optional;

/**
 * Per-request trace data for code that has no access to the servlet request, such as services and the error
 * handler.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(String traceId, String route) {

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private String traceId;
            private String route;

            public Builder traceId(String traceId) {
                this.traceId = traceId;
                return this;
            }

            public Builder route(String route) {
                this.route = route;
                return this;
            }

            public RequestContext build() {
                return new RequestContext(traceId, route);
            }
        }
    }
}
