package com.vigil.checks;

import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.List;

/**
 * {@link DnsResolver} backed by the JDK's JNDI DNS provider.
 */
public final class JndiDnsResolver implements DnsResolver {

    private static final String FACTORY = "com.sun.jndi.dns.DnsContextFactory";

    @Override
    public List<String> lookup(String name, String recordType, String nameserver, Duration timeout)
            throws NamingException {
        Hashtable<String, String> env = new Hashtable<>();
        env.put(DirContext.INITIAL_CONTEXT_FACTORY, FACTORY);
        env.put(DirContext.PROVIDER_URL, nameserver == null ? "dns:" : "dns://" + hostLiteral(nameserver));
        env.put("com.sun.jndi.dns.timeout.initial", String.valueOf(Math.max(1, timeout.toMillis())));
        env.put("com.sun.jndi.dns.timeout.retries", "1");

        DirContext context = new InitialDirContext(env);
        try {
            Attributes attributes = context.getAttributes(name, new String[]{recordType});
            Attribute attribute = attributes.get(recordType);
            List<String> values = new ArrayList<>();
            if (attribute != null) {
                NamingEnumeration<?> all = attribute.getAll();
                while (all.hasMore()) {
                    values.add(normalize(recordType, String.valueOf(all.next())));
                }
            }
            return values;
        } finally {
            context.close();
        }
    }

    /**
     * Strips the trailing root dot of host names and the quotes around TXT strings, so values
     * compare equal to what users write in {@code expected_value}.
     */
    static String normalize(String recordType, String value) {
        String trimmed = value.trim();
        switch (recordType) {
            case "TXT":
                return trimmed.replace("\" \"", "").replace("\"", "");
            case "CNAME":
            case "NS":
            case "PTR":
            case "MX":
            case "SRV":
                return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
            default:
                return trimmed;
        }
    }

    private static String hostLiteral(String nameserver) {
        return nameserver.contains(":") && !nameserver.startsWith("[") ? "[" + nameserver + "]" : nameserver;
    }
}
