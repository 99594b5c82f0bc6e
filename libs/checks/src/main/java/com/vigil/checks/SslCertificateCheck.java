package com.vigil.checks;

import com.vigil.check.Check;
import com.vigil.check.CheckConfig;
import com.vigil.check.CheckDescriptor;
import com.vigil.check.CheckOutcome;
import com.vigil.check.OutcomeKind;
import com.vigil.check.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code ssl_certificate}: completes a TLS handshake and inspects the leaf certificate's validity
 * window.
 * <p>
 * ERROR when outside the validity period or {@code days_left <= critical_days}, WARNING when
 * {@code days_left <= warning_days}, SUCCESS otherwise.
 */
public final class SslCertificateCheck implements Check {

    private static final Logger log = LoggerFactory.getLogger(SslCertificateCheck.class);

    public static final String TYPE = "ssl_certificate";

    static final int DEFAULT_WARNING_DAYS = 30;
    static final int DEFAULT_CRITICAL_DAYS = 14;

    private final SSLSocketFactory socketFactory;

    public SslCertificateCheck() {
        this((SSLSocketFactory) SSLSocketFactory.getDefault());
    }

    SslCertificateCheck(SSLSocketFactory socketFactory) {
        this.socketFactory = socketFactory;
    }

    @Override
    public CheckDescriptor descriptor(String type) {
        return new CheckDescriptor(type, "Checks TLS certificate validity and expiration",
                List.of("hostname"),
                List.of("port", "timeout", "warning_days", "critical_days", "verify_hostname"));
    }

    @Override
    public ValidationResult validate(String type, CheckConfig config) {
        ValidationResult required = Check.super.validate(type, config);
        if (!required.valid()) {
            return required;
        }
        try {
            target(config);
        } catch (IllegalArgumentException e) {
            return ValidationResult.fail(e.getMessage());
        }
        if (config.getInt("critical_days", DEFAULT_CRITICAL_DAYS) > config.getInt("warning_days", DEFAULT_WARNING_DAYS)) {
            return ValidationResult.fail("critical_days must not exceed warning_days");
        }
        return ValidationResult.ok();
    }

    @Override
    public CheckOutcome execute(CheckConfig config) {
        Target target = target(config);
        Duration timeout = config.getDuration("timeout", Duration.ofSeconds(30));
        int warningDays = config.getInt("warning_days", DEFAULT_WARNING_DAYS);
        int criticalDays = config.getInt("critical_days", DEFAULT_CRITICAL_DAYS);
        boolean verifyHostname = config.getBoolean("verify_hostname", true);
        Map<String, Object> where = Map.of("hostname", target.host(), "port", target.port());

        log.debug("Checking TLS certificate for {}:{} (timeout: {}s)", target.host(), target.port(), timeout.toSeconds());
        X509Certificate certificate;
        SSLSession session;
        try (Socket plain = new Socket()) {
            plain.connect(new InetSocketAddress(target.host(), target.port()), (int) timeout.toMillis());
            plain.setSoTimeout((int) timeout.toMillis());
            try (SSLSocket socket = (SSLSocket) socketFactory.createSocket(plain, target.host(), target.port(), true)) {
                if (verifyHostname) {
                    SSLParameters parameters = socket.getSSLParameters();
                    parameters.setEndpointIdentificationAlgorithm("HTTPS");
                    socket.setSSLParameters(parameters);
                }
                socket.startHandshake();
                session = socket.getSession();
                certificate = (X509Certificate) session.getPeerCertificates()[0];
            }
        } catch (SocketTimeoutException e) {
            return IoFailures.error("Connection timed out after " + timeout.toSeconds() + "s", e, where);
        } catch (SSLException e) {
            return IoFailures.error("SSL error: " + e.getMessage(), e, where);
        } catch (IOException e) {
            return IoFailures.error("Connection error: " + e.getMessage(), e, where);
        }

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("hostname", target.host());
        raw.put("port", target.port());
        raw.put("not_before", certificate.getNotBefore().toInstant().toString());
        raw.put("not_after", certificate.getNotAfter().toInstant().toString());
        raw.put("subject", certificate.getSubjectX500Principal().getName());
        raw.put("issuer", certificate.getIssuerX500Principal().getName());
        raw.put("version", certificate.getVersion());
        raw.put("serial_number", certificate.getSerialNumber().toString(16).toUpperCase(Locale.ROOT));
        raw.put("signature_algorithm", certificate.getSigAlgName());
        raw.put("alternative_names", alternativeNames(certificate));
        raw.put("protocol", session.getProtocol());
        raw.put("cipher", session.getCipherSuite());
        Expiry expiry = assess(certificate.getNotBefore().toInstant(), certificate.getNotAfter().toInstant(),
                Instant.now(), warningDays, criticalDays);
        raw.put("days_until_expiration", expiry.daysLeft());
        return new CheckOutcome(expiry.kind(), expiry.message(), Duration.ZERO, raw, null);
    }

    /**
     * Classifies a validity window at a given instant.
     */
    static Expiry assess(Instant notBefore, Instant notAfter, Instant now, int warningDays, int criticalDays) {
        long daysLeft = Duration.between(now, notAfter).toDays();
        if (now.isBefore(notBefore)) {
            return new Expiry(OutcomeKind.ERROR, daysLeft, "Certificate not yet valid. Valid from " + notBefore);
        }
        if (now.isAfter(notAfter)) {
            return new Expiry(OutcomeKind.ERROR, daysLeft, "Certificate expired on " + notAfter);
        }
        if (daysLeft <= criticalDays) {
            return new Expiry(OutcomeKind.ERROR, daysLeft,
                    "Certificate expires very soon: " + daysLeft + " days left (expires on " + notAfter + ")");
        }
        if (daysLeft <= warningDays) {
            return new Expiry(OutcomeKind.WARNING, daysLeft,
                    "Certificate expiration approaching: " + daysLeft + " days left (expires on " + notAfter + ")");
        }
        return new Expiry(OutcomeKind.SUCCESS, daysLeft,
                "Certificate valid until " + notAfter + " (" + daysLeft + " days remaining)");
    }

    /**
     * Host and port to connect to. A URL is accepted in {@code hostname}: its host and port are
     * used, with port 80 for a plain {@code http} URL unless {@code port} is configured.
     */
    static Target target(CheckConfig config) {
        String hostname = config.require("hostname");
        int port = config.getInt("port", 443);
        if (hostname.startsWith("http://") || hostname.startsWith("https://")) {
            URI uri;
            try {
                uri = URI.create(hostname);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid URL format: " + hostname, e);
            }
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("Invalid URL format: " + hostname + ". Could not extract hostname.");
            }
            if (uri.getPort() != -1) {
                port = uri.getPort();
            } else if ("http".equals(uri.getScheme()) && !config.has("port")) {
                port = 80;
            }
            return new Target(uri.getHost(), port);
        }
        return new Target(hostname, port);
    }

    private static List<String> alternativeNames(X509Certificate certificate) {
        List<String> names = new ArrayList<>();
        try {
            Collection<List<?>> entries = certificate.getSubjectAlternativeNames();
            if (entries != null) {
                for (List<?> entry : entries) {
                    if (entry.size() > 1) {
                        names.add(String.valueOf(entry.get(1)));
                    }
                }
            }
        } catch (CertificateParsingException e) {
            log.debug("Could not read subject alternative names: {}", e.getMessage());
        }
        return names;
    }

    record Target(String host, int port) {
    }

    record Expiry(OutcomeKind kind, long daysLeft, String message) {
    }
}
