package com.jmapmail.webhook;

import com.jmapmail.config.ServerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.security.PublicKey;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Downloads and caches SNS signing certificates
 * - Only https URLs on an SNS host under the configured suffix are fetched
 */
@Slf4j
@Component
public class SigningCertificateCache {

    private final RestClient restClient;
    private final ServerProperties properties;
    private final Map<String, PublicKey> cache = new ConcurrentHashMap<>();

    public SigningCertificateCache(@Qualifier("snsRestClient") RestClient restClient, ServerProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    /**
     * Public key of the certificate at {@code url}; null when the URL is not trusted or the fetch fails
     */
    public PublicKey getPublicKey(String url) {
        if (!isTrustedUrl(url)) {
            log.warn("Untrusted SNS certificate URL: {}", url);
            return null;
        }
        PublicKey cached = cache.get(url);
        if (cached != null) {
            return cached;
        }
        try {
            byte[] pem = restClient.get().uri(url).retrieve().body(byte[].class);
            if (pem == null) {
                log.warn("Empty SNS certificate response from {}", url);
                return null;
            }
            X509Certificate certificate = (X509Certificate) CertificateFactory.getInstance("X.509")
                    .generateCertificate(new ByteArrayInputStream(pem));
            certificate.checkValidity();
            PublicKey key = certificate.getPublicKey();
            cache.put(url, key);
            return key;
        } catch (RestClientException e) {
            log.error("Failed to download SNS certificate from {}", url, e);
            return null;
        } catch (CertificateException e) {
            log.error("Invalid SNS certificate at {}", url, e);
            return null;
        }
    }

    /**
     * https, host ends with the configured suffix and names the SNS service
     */
    public boolean isTrustedUrl(String url) {
        if (url == null) {
            return false;
        }
        try {
            URI uri = new URI(url);
            if (!"https".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
                return false;
            }
            String host = uri.getHost().toLowerCase(Locale.ROOT);
            return host.endsWith(properties.getWebhook().getCertificateHostSuffix().toLowerCase(Locale.ROOT))
                    && (host.startsWith("sns.") || host.contains(".sns."));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
