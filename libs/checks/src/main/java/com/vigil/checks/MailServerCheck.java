package com.vigil.checks;

import com.vigil.check.Check;
import com.vigil.check.CheckConfig;
import com.vigil.check.CheckDescriptor;
import com.vigil.check.CheckOutcome;
import com.vigil.check.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.naming.NamingException;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code mail_server}: opens a socket to an SMTP, IMAP or POP3 server, checks the greeting and
 * capability exchange and, when credentials are configured, logs in.
 * <p>
 * With {@code resolve_mx} the domain's MX records are looked up first and the most preferred
 * exchange is probed instead of {@code hostname}.
 */
public final class MailServerCheck implements Check {

    private static final Logger log = LoggerFactory.getLogger(MailServerCheck.class);

    public static final String TYPE = "mail_server";

    static final String EHLO_NAME = "vigil.local";

    private static final Pattern EXISTS = Pattern.compile("^\\* (\\d+) EXISTS", Pattern.CASE_INSENSITIVE);
    private static final List<String> NOTABLE_IMAP_CAPABILITIES = List.of("AUTH=", "STARTTLS", "IDLE", "UIDPLUS");

    /**
     * Supported protocols and their well-known ports.
     */
    enum Protocol {
        SMTP(25, 465),
        IMAP(143, 993),
        POP3(110, 995);

        private final int plainPort;
        private final int sslPort;

        Protocol(int plainPort, int sslPort) {
            this.plainPort = plainPort;
            this.sslPort = sslPort;
        }

        int defaultPort(boolean useSsl) {
            return useSsl ? sslPort : plainPort;
        }

        static Protocol parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid protocol: " + value + ". Must be one of: smtp, imap, pop3", e);
            }
        }
    }

    private final DnsResolver resolver;
    private final SSLSocketFactory tls;

    public MailServerCheck() {
        this(new JndiDnsResolver());
    }

    public MailServerCheck(DnsResolver resolver) {
        this(resolver, (SSLSocketFactory) SSLSocketFactory.getDefault());
    }

    MailServerCheck(DnsResolver resolver, SSLSocketFactory tls) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver must not be null");
        }
        this.resolver = resolver;
        this.tls = tls;
    }

    @Override
    public CheckDescriptor descriptor(String type) {
        return new CheckDescriptor(type, "Checks SMTP, IMAP or POP3 server connectivity and authentication",
                List.of("hostname", "protocol"),
                List.of("port", "username", "password", "use_ssl", "use_tls", "timeout", "resolve_mx"));
    }

    @Override
    public ValidationResult validate(String type, CheckConfig config) {
        ValidationResult required = Check.super.validate(type, config);
        if (!required.valid()) {
            return required;
        }
        List<String> errors = new ArrayList<>();
        try {
            Protocol.parse(config.require("protocol"));
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (config.has("username") && !config.has("password")) {
            errors.add("Password is required when username is provided");
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    @Override
    public CheckOutcome execute(CheckConfig config) {
        String configured = config.require("hostname");
        Protocol protocol = Protocol.parse(config.require("protocol"));
        boolean useSsl = config.getBoolean("use_ssl", false);
        int port = config.getInt("port", protocol.defaultPort(useSsl));
        Duration timeout = config.getDuration("timeout", Duration.ofSeconds(30));

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("hostname", configured);
        raw.put("port", port);
        raw.put("protocol", protocol.name().toLowerCase(Locale.ROOT));
        raw.put("use_ssl", useSsl);
        raw.put("mx_records", null);

        String host = configured;
        if (config.getBoolean("resolve_mx", false) && configured.contains(".")
                && !Character.isDigit(configured.charAt(0))) {
            host = resolveMx(configured, timeout, raw);
        }
        String where = host.equals(configured)
                ? " " + host + ":" + port
                : " for " + configured + " (using " + host + ":" + port + ")";

        log.debug("Checking {} server {}:{}", protocol, host, port);
        Probe probe = new Probe(config, host, port, where, raw);
        try (MailSession session = MailSession.open(host, port, timeout, useSsl ? tls : null)) {
            raw.put("local_address", session.localAddress());
            raw.put("remote_address", session.remoteAddress());
            CheckOutcome outcome = switch (protocol) {
                case SMTP -> smtp(session, probe);
                case IMAP -> imap(session, probe);
                case POP3 -> pop3(session, probe);
            };
            log.info("Mail server check result: {} - {}", outcome.kind().wireName(), outcome.message());
            return outcome;
        } catch (IOException e) {
            return IoFailures.error("Connection error checking " + protocol + " server" + where + ": " + e.getMessage(),
                    e, raw);
        }
    }

    private CheckOutcome smtp(MailSession session, Probe probe) throws IOException {
        MailSession.SmtpReply banner = session.readSmtpReply();
        probe.raw().put("initial_response", banner.toString());
        if (banner.code() != 220) {
            return probe.error("SMTP error: unexpected greeting " + banner);
        }
        MailSession.SmtpReply ehlo = session.smtp("EHLO " + EHLO_NAME);
        if (ehlo.code() != 250) {
            return probe.error("SMTP error: EHLO rejected with " + ehlo);
        }
        Map<String, String> extensions = extensions(ehlo);
        probe.raw().put("ehlo_code", ehlo.code());
        probe.raw().put("ehlo_message", ehlo.text());
        probe.raw().put("supports_tls", extensions.containsKey("STARTTLS"));

        if (probe.config().getBoolean("use_tls", false) && !probe.config().getBoolean("use_ssl", false)) {
            if (!extensions.containsKey("STARTTLS")) {
                return probe.error("SMTP error: server does not support STARTTLS");
            }
            MailSession.SmtpReply ready = session.smtp("STARTTLS");
            if (ready.code() != 220) {
                return probe.error("SMTP error: STARTTLS rejected with " + ready);
            }
            session.startTls(tls, probe.host(), probe.port());
            ehlo = session.smtp("EHLO " + EHLO_NAME);
            probe.raw().put("tls_response", ehlo.toString());
            extensions = extensions(ehlo);
        }
        probe.raw().put("extensions", extensions);

        String username = probe.username();
        if (username != null) {
            String token = Base64.getEncoder().encodeToString(
                    ("\0" + username + "\0" + probe.password()).getBytes(StandardCharsets.UTF_8));
            MailSession.SmtpReply auth = session.smtp("AUTH PLAIN " + token);
            if (auth.code() != 235) {
                quietly(session, "QUIT");
                return probe.error("SMTP authentication failed for user " + username);
            }
            probe.raw().put("authenticated", true);
        }
        session.smtp("QUIT");

        if (username != null) {
            return probe.success("SMTP server check successful, authenticated as " + username);
        }
        String message = "SMTP server" + probe.where() + " is operational";
        if (!extensions.isEmpty()) {
            message += ". Supports: " + String.join(", ", extensions.keySet());
        }
        return probe.success(message);
    }

    private CheckOutcome imap(MailSession session, Probe probe) throws IOException {
        String banner = session.readLine();
        probe.raw().put("welcome_message", banner);
        if (!banner.regionMatches(true, 0, "* OK", 0, 4) && !banner.regionMatches(true, 0, "* PREAUTH", 0, 9)) {
            return probe.error("IMAP error: unexpected greeting " + banner);
        }
        MailSession.ImapReply capability = session.imap("a1", "CAPABILITY");
        if (!capability.ok()) {
            return probe.error("IMAP error: CAPABILITY failed: " + capability.completion());
        }
        String capabilities = capability.untagged().stream()
                .filter(line -> line.regionMatches(true, 0, "* CAPABILITY ", 0, 13))
                .map(line -> line.substring(13).trim())
                .findFirst()
                .orElse("");
        probe.raw().put("capabilities", capabilities);

        String username = probe.username();
        String message;
        if (username != null) {
            MailSession.ImapReply login = session.imap("a2", "LOGIN " + quote(username) + " " + quote(probe.password()));
            if (!login.ok()) {
                quietly(session, "a9 LOGOUT");
                return probe.error("IMAP authentication failed for user " + username);
            }
            probe.raw().put("authenticated", true);
            message = "IMAP server check successful, authenticated as " + username;
            MailSession.ImapReply inbox = session.imap("a3", "EXAMINE INBOX");
            if (inbox.ok()) {
                probe.raw().put("mailbox_status", "OK");
                for (String line : inbox.untagged()) {
                    Matcher matcher = EXISTS.matcher(line);
                    if (matcher.find()) {
                        int count = Integer.parseInt(matcher.group(1));
                        probe.raw().put("mailbox_message_count", count);
                        message += ", INBOX contains " + count + " messages";
                    }
                }
            } else {
                probe.raw().put("mailbox_status", "ERROR");
            }
        } else {
            message = "IMAP server" + probe.where() + " is operational";
            List<String> notable = new ArrayList<>();
            for (String cap : capabilities.split("\\s+")) {
                if (NOTABLE_IMAP_CAPABILITIES.stream().anyMatch(cap::contains)) {
                    notable.add(cap);
                }
            }
            if (!notable.isEmpty()) {
                message += ". Notable capabilities: " + String.join(", ", notable);
            }
        }
        session.imap("a4", "LOGOUT");
        return probe.success(message);
    }

    private CheckOutcome pop3(MailSession session, Probe probe) throws IOException {
        String welcome = session.readLine();
        probe.raw().put("welcome_message", welcome);
        if (!welcome.startsWith("+OK")) {
            return probe.error("POP3 protocol error: unexpected greeting " + welcome);
        }
        session.send("CAPA");
        String capa = session.readLine();
        boolean hasCapabilities = capa.startsWith("+OK");
        if (hasCapabilities) {
            probe.raw().put("capabilities", session.readPopLines());
        } else {
            probe.raw().put("capabilities", "Not supported or error");
            probe.raw().put("capabilities_error", capa);
        }

        String username = probe.username();
        String message;
        if (username != null) {
            session.send("USER " + username);
            String user = session.readLine();
            String pass = "-ERR";
            if (user.startsWith("+OK")) {
                session.send("PASS " + probe.password());
                pass = session.readLine();
            }
            if (!pass.startsWith("+OK")) {
                quietly(session, "QUIT");
                return probe.error("POP3 authentication failed for user " + username);
            }
            probe.raw().put("authenticated", true);
            session.send("STAT");
            String[] stat = session.readLine().split("\\s+");
            if (stat.length >= 3 && "+OK".equals(stat[0])) {
                probe.raw().put("message_count", Integer.parseInt(stat[1]));
                probe.raw().put("mailbox_size", Long.parseLong(stat[2]));
            }
            message = "POP3 server check successful, authenticated as " + username + ", "
                    + probe.raw().getOrDefault("message_count", 0) + " messages in mailbox";
        } else {
            message = "POP3 server" + probe.where() + " is operational";
            String text = welcome.substring(3).trim();
            if (!text.isEmpty()) {
                message += ". Welcome: " + (text.length() > 50 ? text.substring(0, 47) + "..." : text);
            }
            if (hasCapabilities) {
                message += ". Capabilities available.";
            }
        }
        session.send("QUIT");
        session.readLine();
        return probe.success(message);
    }

    private String resolveMx(String domain, Duration timeout, Map<String, Object> raw) {
        try {
            List<String[]> exchanges = new ArrayList<>();
            for (String record : resolver.lookup(domain, "MX", null, timeout)) {
                String[] parts = record.trim().split("\\s+");
                if (parts.length == 2) {
                    exchanges.add(parts);
                }
            }
            exchanges.sort(Comparator.comparingInt(parts -> Integer.parseInt(parts[0])));
            List<String> hosts = exchanges.stream().map(parts -> parts[1]).toList();
            raw.put("mx_records", hosts);
            if (!hosts.isEmpty()) {
                raw.put("hostname_used", hosts.get(0));
                log.info("Using highest priority MX record: {}", hosts.get(0));
                return hosts.get(0);
            }
        } catch (NamingException | NumberFormatException e) {
            log.warn("Could not resolve MX records for {}: {}", domain, e.getMessage());
            raw.put("mx_error", String.valueOf(e.getMessage()));
        }
        return domain;
    }

    private static Map<String, String> extensions(MailSession.SmtpReply ehlo) {
        Map<String, String> extensions = new LinkedHashMap<>();
        for (String line : ehlo.lines().subList(1, ehlo.lines().size())) {
            String[] parts = line.trim().split("\\s+", 2);
            if (!parts[0].isEmpty()) {
                extensions.put(parts[0].toUpperCase(Locale.ROOT), parts.length > 1 ? parts[1] : "");
            }
        }
        return extensions;
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static void quietly(MailSession session, String command) {
        try {
            session.send(command);
        } catch (IOException e) {
            log.debug("Ignoring failure while closing mail session: {}", e.getMessage());
        }
    }

    private record Probe(CheckConfig config, String host, int port, String where, Map<String, Object> raw) {

        String username() {
            String username = config.getString("username", null);
            return username == null || username.isEmpty() || !config.has("password") ? null : username;
        }

        String password() {
            return config.getString("password", "");
        }

        CheckOutcome success(String message) {
            return CheckOutcome.success(message, Duration.ZERO, raw);
        }

        CheckOutcome error(String message) {
            return CheckOutcome.error(message, Duration.ZERO, raw);
        }
    }
}
