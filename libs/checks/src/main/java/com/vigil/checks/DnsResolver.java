package com.vigil.checks;

import javax.naming.NamingException;
import java.time.Duration;
import java.util.List;

/**
 * Resolves one DNS record set.
 */
public interface DnsResolver {

    /**
     * Looks up the records of a type for a name.
     *
     * @param name       fully qualified domain name
     * @param recordType record type (A, MX, TXT, ...)
     * @param nameserver resolver address to ask, or null for the system resolvers
     * @param timeout    query timeout
     * @return record values in presentation format; empty if the name exists without such records
     * @throws javax.naming.NameNotFoundException if the name does not exist (NXDOMAIN)
     * @throws NamingException                    on any other resolution failure, including timeouts
     */
    List<String> lookup(String name, String recordType, String nameserver, Duration timeout) throws NamingException;
}
