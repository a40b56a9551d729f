package com.inspectvoice.sealing.filter;

import com.inspectvoice.sealing.resource.dto.VerificationResponse;
import com.inspectvoice.sealing.util.SealingMetrics;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Fixed-window, per-client-IP rate limit for the public verification endpoints
 * ({@code /api/v1/verify*}).
 * <p>
 * Counters live in this process only; every instance enforces its own window.
 * <p>
 * The client is keyed on {@code CF-Connecting-IP} when the Cloudflare header is trusted,
 * then on {@code X-Forwarded-For} only when the connecting peer is a configured trusted
 * proxy, and otherwise on the peer address itself.
 */
@Provider
@Priority(Priorities.AUTHENTICATION - 100)
public class VerifyRateLimitFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(VerifyRateLimitFilter.class);
    private static final String VERIFY_PATH_PREFIX = "/api/v1/verify";
    private static final int PRUNE_THRESHOLD = 10_000;

    @ConfigProperty(name = "app.verify.rate-limit.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "app.verify.rate-limit.max-requests", defaultValue = "30")
    int maxRequests;

    @ConfigProperty(name = "app.verify.rate-limit.window-seconds", defaultValue = "60")
    int windowSeconds;

    @ConfigProperty(name = "app.verify.rate-limit.trust-cloudflare-header", defaultValue = "true")
    boolean trustCloudflareHeader;

    @ConfigProperty(name = "app.verify.rate-limit.trusted-proxies")
    Optional<List<String>> trustedProxies;

    @Inject
    SealingMetrics sealingMetrics;

    @Context
    HttpServerRequest httpRequest;

    LongSupplier clockMillis = System::currentTimeMillis;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        LOG.infof("VerifyRateLimitFilter initialized: enabled=%s, maxRequests=%d, windowSeconds=%d, "
                        + "trustCloudflareHeader=%s, trustedProxies=%s",
                enabled, maxRequests, windowSeconds, trustCloudflareHeader, trustedProxies.orElse(List.of()));
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!enabled) {
            return;
        }
        String path = requestContext.getUriInfo().getPath();
        if (!path.startsWith(VERIFY_PATH_PREFIX)) {
            return;
        }

        String clientIp = clientIp(requestContext);
        if (isRateLimited(clientIp)) {
            sealingMetrics.incrementVerifyRateLimited();
            LOG.warnf("Verification rate limit exceeded for client %s", clientIp);
            requestContext.abortWith(
                    Response.status(Response.Status.TOO_MANY_REQUESTS)
                            .type(MediaType.APPLICATION_JSON)
                            .header("Retry-After", String.valueOf(windowSeconds))
                            .entity(VerificationResponse.rejected("rate_limited",
                                    "Rate limit exceeded. Try again in " + windowSeconds + " seconds."))
                            .build());
        }
    }

    boolean isRateLimited(String clientIp) {
        long now = clockMillis.getAsLong();
        if (windows.size() > PRUNE_THRESHOLD) {
            windows.values().removeIf(w -> w.resetAt <= now);
        }
        Window window = windows.compute(clientIp, (ip, existing) -> {
            if (existing == null || now >= existing.resetAt) {
                return new Window(now + windowSeconds * 1000L);
            }
            existing.count++;
            return existing;
        });
        return window.count > maxRequests;
    }

    String clientIp(ContainerRequestContext requestContext) {
        if (trustCloudflareHeader) {
            String cfIp = requestContext.getHeaderString("CF-Connecting-IP");
            if (cfIp != null && !cfIp.isBlank()) {
                return cfIp.trim();
            }
        }
        String peer = peerAddress();
        if (peer != null && isTrustedProxy(peer)) {
            String forwarded = requestContext.getHeaderString("X-Forwarded-For");
            if (forwarded != null) {
                // each proxy appends the address it saw, so read from the right
                String[] hops = forwarded.split(",");
                for (int i = hops.length - 1; i >= 0; i--) {
                    String hop = hops[i].trim();
                    if (!hop.isEmpty() && !isTrustedProxy(hop)) {
                        return hop;
                    }
                }
            }
        }
        return peer != null ? peer : "unknown";
    }

    private String peerAddress() {
        if (httpRequest == null) {
            return null;
        }
        SocketAddress remote = httpRequest.remoteAddress();
        if (remote == null) {
            return null;
        }
        return remote.hostAddress() != null ? remote.hostAddress() : remote.host();
    }

    private boolean isTrustedProxy(String address) {
        return trustedProxies.map(proxies -> proxies.contains(address)).orElse(false);
    }

    private static final class Window {
        private final long resetAt;
        private int count = 1;

        private Window(long resetAt) {
            this.resetAt = resetAt;
        }
    }
}
