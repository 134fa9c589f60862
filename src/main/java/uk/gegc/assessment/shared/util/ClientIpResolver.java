package uk.gegc.assessment.shared.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Resolves the requester's IP, honouring {@code X-Forwarded-For} only when the
 * request comes through a configured trusted proxy.
 */
@Component
public class ClientIpResolver {

    @Value("${app.security.trusted-proxies:}")
    private String trustedProxiesConfig;

    @Value("${app.security.enable-forwarded-headers:false}")
    private boolean enableForwardedHeaders;

    private volatile List<String> trustedProxies;

    public String resolve(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!enableForwardedHeaders) {
            return remoteAddr;
        }

        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor == null || forwardedFor.isBlank() || !isTrustedProxy(remoteAddr)) {
            return remoteAddr;
        }

        // Leftmost entry is the original client
        String clientIp = forwardedFor.split(",")[0].trim();
        return isPlausibleIp(clientIp) ? clientIp : remoteAddr;
    }

    private boolean isTrustedProxy(String ip) {
        if (trustedProxies == null) {
            trustedProxies = trustedProxiesConfig == null || trustedProxiesConfig.isBlank()
                    ? List.of("127.0.0.1", "::1")
                    : Arrays.stream(trustedProxiesConfig.split(",")).map(String::trim).toList();
        }
        return trustedProxies.stream().anyMatch(ip::startsWith);
    }

    private boolean isPlausibleIp(String ip) {
        if (ip.isEmpty()) {
            return false;
        }
        if (ip.contains(":")) {
            return ip.matches("^[0-9a-fA-F:]+$");
        }
        String[] parts = ip.split("\\.");
        if (parts.length != 4) {
            return false;
        }
        for (String part : parts) {
            if (!part.matches("\\d{1,3}") || Integer.parseInt(part) > 255) {
                return false;
            }
        }
        return true;
    }
}
