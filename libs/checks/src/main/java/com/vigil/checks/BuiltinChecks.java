package com.vigil.checks;

import com.vigil.check.CheckRegistry;

/**
 * Registers the built-in check types under their tags.
 */
public final class BuiltinChecks {

    private BuiltinChecks() {
    }

    /**
     * Registers every built-in check using the system DNS provider.
     *
     * @param registry the registry to populate
     * @return the same registry
     */
    public static CheckRegistry registerAll(CheckRegistry registry) {
        return registerAll(registry, new JndiDnsResolver());
    }

    /**
     * Registers every built-in check, resolving DNS through the given resolver.
     */
    public static CheckRegistry registerAll(CheckRegistry registry, DnsResolver resolver) {
        return registry
                .register(WebsiteStatusCheck.TYPE, new WebsiteStatusCheck())
                .register(SslCertificateCheck.TYPE, new SslCertificateCheck())
                .register(DnsRecordCheck.TYPE, new DnsRecordCheck(resolver))
                .register(MailServerCheck.TYPE, new MailServerCheck(resolver));
    }
}
