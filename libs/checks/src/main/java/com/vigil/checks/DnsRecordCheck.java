package com.vigil.checks;

import com.vigil.check.Check;
import com.vigil.check.CheckConfig;
import com.vigil.check.CheckDescriptor;
import com.vigil.check.CheckOutcome;
import com.vigil.check.DaemonThreads;
import com.vigil.check.OutcomeKind;
import com.vigil.check.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.naming.NameNotFoundException;
import javax.naming.NamingException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Pattern;

/**
 * {@code dns_record}: resolves one record set, optionally compares it with expected values and
 * measures propagation across several public resolvers.
 */
public final class DnsRecordCheck implements Check {

    private static final Logger log = LoggerFactory.getLogger(DnsRecordCheck.class);

    public static final String TYPE = "dns_record";

    public static final List<String> RECORD_TYPES =
            List.of("A", "AAAA", "CNAME", "MX", "NS", "TXT", "SOA", "SRV", "PTR", "CAA");

    /** Resolvers asked when propagation is checked without an explicit list. */
    public static final List<PublicResolver> DEFAULT_RESOLVERS = List.of(
            new PublicResolver("8.8.8.8", "Google", "Google DNS"),
            new PublicResolver("8.8.4.4", "Google", "Google DNS"),
            new PublicResolver("1.1.1.1", "Cloudflare", "Cloudflare DNS"),
            new PublicResolver("1.0.0.1", "Cloudflare", "Cloudflare DNS"),
            new PublicResolver("9.9.9.9", "Quad9", "Quad9 DNS"),
            new PublicResolver("149.112.112.112", "Quad9", "Quad9 DNS"),
            new PublicResolver("208.67.222.222", "OpenDNS", "OpenDNS"),
            new PublicResolver("208.67.220.220", "OpenDNS", "OpenDNS"));

    static final double DEFAULT_PROPAGATION_THRESHOLD = 80.0;
    static final int MAX_PROPAGATION_QUERIES = 10;

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})(\\.\\d{1,3}){3}$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]+$");

    private final DnsResolver resolver;

    public DnsRecordCheck() {
        this(new JndiDnsResolver());
    }

    public DnsRecordCheck(DnsResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver must not be null");
        }
        this.resolver = resolver;
    }

    /**
     * A resolver taking part in a propagation check.
     */
    public record PublicResolver(String ip, String name, String provider) {
    }

    @Override
    public CheckDescriptor descriptor(String type) {
        return new CheckDescriptor(type, "Checks DNS record existence, content and propagation",
                List.of("domain", "record_type"),
                List.of("expected_value", "nameserver", "subdomain", "timeout", "check_propagation",
                        "resolvers", "propagation_threshold"));
    }

    @Override
    public ValidationResult validate(String type, CheckConfig config) {
        ValidationResult required = Check.super.validate(type, config);
        if (!required.valid()) {
            return required;
        }
        List<String> errors = new ArrayList<>();
        String recordType = config.getString("record_type", "").toUpperCase(Locale.ROOT);
        if (!RECORD_TYPES.contains(recordType)) {
            errors.add("Invalid record type: " + recordType + ". Must be one of: " + String.join(", ", RECORD_TYPES));
        }
        if (config.getBoolean("check_propagation", false)) {
            double threshold = config.getDouble("propagation_threshold", DEFAULT_PROPAGATION_THRESHOLD);
            if (threshold < 0 || threshold > 100) {
                errors.add("Propagation threshold must be a percentage between 0 and 100");
            }
        }
        if (config.has("resolvers")) {
            try {
                resolvers(config);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    @Override
    public CheckOutcome execute(CheckConfig config) throws InterruptedException {
        String domain = config.require("domain");
        String recordType = config.require("record_type").toUpperCase(Locale.ROOT);
        String subdomain = config.getString("subdomain", "");
        String fullDomain = subdomain.isBlank() ? domain : subdomain + "." + domain;
        String nameserver = config.getString("nameserver", null);
        Duration timeout = config.getDuration("timeout", Duration.ofSeconds(10));
        List<String> expected = config.getStringList("expected_value");
        boolean expectedIsList = config.get("expected_value").orElse(null) instanceof List;

        log.debug("Checking DNS {} record for {}", recordType, fullDomain);
        long start = System.nanoTime();
        List<String> values;
        try {
            values = resolver.lookup(fullDomain, recordType, nameserver, timeout);
        } catch (NameNotFoundException e) {
            return failure("Domain " + fullDomain + " does not exist", "NXDOMAIN", fullDomain, recordType, start);
        } catch (NamingException e) {
            if (isTimeout(e)) {
                return failure("Timeout resolving " + recordType + " records for " + fullDomain, "Timeout",
                        fullDomain, recordType, start);
            }
            Map<String, Object> context = Map.of("domain", fullDomain, "record_type", recordType);
            return IoFailures.error("Error checking DNS records: " + e.getMessage(), e, context);
        }
        if (values.isEmpty()) {
            return failure("No " + recordType + " records found for " + fullDomain, "NoAnswer",
                    fullDomain, recordType, start);
        }

        boolean expectedMatch = values.containsAll(expected);
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("domain", fullDomain);
        raw.put("record_type", recordType);
        raw.put("records", values);
        raw.put("expected_value", expected.isEmpty() ? null : (expectedIsList ? expected : expected.get(0)));
        raw.put("expected_value_match", expectedMatch);
        raw.put("query_time", seconds(start));
        raw.put("nameserver", nameserver == null ? "system" : nameserver);

        OutcomeKind kind = OutcomeKind.SUCCESS;
        List<String> issues = new ArrayList<>();
        if (!expectedMatch) {
            kind = OutcomeKind.ERROR;
            issues.add(expectedIsList
                    ? "Expected values " + expected + " not all found"
                    : "Expected value '" + expected.get(0) + "' not found");
        }
        if (config.getBoolean("check_propagation", false)) {
            Propagation propagation = propagation(config, fullDomain, recordType, expected, timeout);
            raw.put("propagation", propagation.asMap());
            if (propagation.kind() != OutcomeKind.SUCCESS) {
                kind = kind.worse(propagation.kind());
                issues.add((propagation.kind() == OutcomeKind.ERROR ? "Poor" : "Partial") + " propagation: "
                        + propagation.roundedPercentage() + "% (" + propagation.consistent() + "/" + propagation.total()
                        + " resolvers)");
            }
        }

        String message;
        if (kind == OutcomeKind.SUCCESS) {
            if (!expected.isEmpty()) {
                message = expectedIsList
                        ? "DNS " + recordType + " records for " + fullDomain + " contain all expected values"
                        : "DNS " + recordType + " record for " + fullDomain + " matches expected value";
            } else {
                message = "DNS " + recordType + (values.size() > 1 ? " records" : " record") + " found for " + fullDomain;
            }
        } else {
            message = "DNS " + recordType + " record check for " + fullDomain + " has issues: " + String.join(", ", issues);
        }
        message += values.size() <= 5 ? ". Values: " + String.join(", ", values) : ". Found " + values.size() + " records";
        return new CheckOutcome(kind, message, Duration.ZERO, raw, null);
    }

    private Propagation propagation(CheckConfig config, String domain, String recordType, List<String> expected,
                                    Duration timeout) throws InterruptedException {
        List<PublicResolver> targets = config.has("resolvers") ? resolvers(config) : DEFAULT_RESOLVERS;
        double threshold = config.getDouble("propagation_threshold", DEFAULT_PROPAGATION_THRESHOLD);
        List<Map<String, Object>> answers = new ArrayList<>();
        if (targets.isEmpty()) {
            return Propagation.of(answers, threshold);
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(MAX_PROPAGATION_QUERIES, targets.size()),
                DaemonThreads.named("vigil-dns"));
        try {
            List<Future<Map<String, Object>>> futures = new ArrayList<>();
            for (PublicResolver target : targets) {
                futures.add(executor.submit(() -> queryResolver(target, domain, recordType, expected, timeout)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    answers.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Map<String, Object> failed = resolverEntry(targets.get(i), "error");
                    failed.put("error", String.valueOf(e.getCause()));
                    failed.put("match", false);
                    answers.add(failed);
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return Propagation.of(answers, threshold);
    }

    private Map<String, Object> queryResolver(PublicResolver target, String domain, String recordType,
                                              List<String> expected, Duration timeout) {
        long start = System.nanoTime();
        try {
            List<String> values = resolver.lookup(domain, recordType, target.ip(), timeout);
            Map<String, Object> entry = resolverEntry(target, values.isEmpty() ? "error" : "success");
            entry.put("response_time", seconds(start));
            entry.put("records", values);
            entry.put("match", !values.isEmpty() && values.containsAll(expected));
            if (values.isEmpty()) {
                entry.put("error", "NoAnswer");
            }
            return entry;
        } catch (NamingException e) {
            Map<String, Object> entry = resolverEntry(target, "error");
            entry.put("response_time", seconds(start));
            entry.put("error", e instanceof NameNotFoundException ? "NXDOMAIN" : isTimeout(e) ? "Timeout" : e.getMessage());
            entry.put("match", false);
            return entry;
        }
    }

    private static Map<String, Object> resolverEntry(PublicResolver target, String status) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("resolver", target.ip());
        entry.put("name", target.name());
        entry.put("provider", target.provider());
        entry.put("status", status);
        return entry;
    }

    static List<PublicResolver> resolvers(CheckConfig config) {
        Object value = config.get("resolvers").orElse(List.of());
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("Resolvers must be a list of IP addresses or resolver objects");
        }
        List<PublicResolver> result = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof String ip) {
                result.add(new PublicResolver(requireIp(ip), ip, "Custom"));
            } else if (item instanceof Map<?, ?> map) {
                Object ip = map.get("ip");
                if (ip == null) {
                    throw new IllegalArgumentException("Missing 'ip' key in resolver object: " + map);
                }
                String address = requireIp(String.valueOf(ip));
                Object name = map.get("name");
                Object provider = map.get("provider");
                result.add(new PublicResolver(address, name == null ? address : String.valueOf(name),
                        provider == null ? "Unknown" : String.valueOf(provider)));
            } else {
                throw new IllegalArgumentException("Invalid resolver format: " + item);
            }
        }
        return result;
    }

    private static String requireIp(String ip) {
        boolean v4 = IPV4.matcher(ip).matches();
        boolean v6 = ip.contains(":") && IPV6.matcher(ip).matches();
        if (!v4 && !v6) {
            throw new IllegalArgumentException("Invalid resolver IP address: " + ip);
        }
        return ip;
    }

    private static boolean isTimeout(NamingException e) {
        Throwable cause = e.getRootCause() != null ? e.getRootCause() : e.getCause();
        return cause instanceof SocketTimeoutException
                || (e.getMessage() != null && e.getMessage().toLowerCase(Locale.ROOT).contains("timeout"));
    }

    private static CheckOutcome failure(String message, String error, String domain, String recordType, long start) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("domain", domain);
        raw.put("record_type", recordType);
        raw.put(CheckOutcome.ERROR_KEY, error);
        raw.put("query_time", seconds(start));
        return CheckOutcome.error(message, Duration.ZERO, raw);
    }

    private static double seconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    /**
     * Share of resolvers returning a matching answer, graded against the threshold: SUCCESS at or
     * above it, WARNING at or above 70% of it, ERROR below.
     */
    record Propagation(OutcomeKind kind, int total, int successful, int consistent, double percentage,
                       double threshold, List<Map<String, Object>> resolvers) {

        static Propagation of(List<Map<String, Object>> answers, double threshold) {
            int total = answers.size();
            int successful = (int) answers.stream().filter(a -> "success".equals(a.get("status"))).count();
            int consistent = (int) answers.stream().filter(a -> Boolean.TRUE.equals(a.get("match"))).count();
            double percentage = total == 0 ? 0.0 : consistent * 100.0 / total;
            OutcomeKind kind;
            if (percentage >= threshold) {
                kind = OutcomeKind.SUCCESS;
            } else if (percentage >= threshold * 0.7) {
                kind = OutcomeKind.WARNING;
            } else {
                kind = OutcomeKind.ERROR;
            }
            return new Propagation(kind, total, successful, consistent, percentage, threshold, answers);
        }

        /** Percentage to one decimal, for display only. */
        double roundedPercentage() {
            return Math.round(percentage * 10) / 10.0;
        }

        Map<String, Object> asMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("status", kind.wireName());
            map.put("total_count", total);
            map.put("successful_count", successful);
            map.put("consistent_count", consistent);
            map.put("percentage", roundedPercentage());
            map.put("threshold", threshold);
            map.put("resolvers", resolvers);
            return map;
        }
    }
}
