package com.khaounen.botguard.security.reputation;

import com.khaounen.botguard.utils.IpUtils;
import lombok.extern.slf4j.Slf4j;

import javax.naming.Context;
import javax.naming.NameNotFoundException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.List;
import java.util.Map;

/**
 * Tor exit lookup through a DNS blacklist: {@code 4.3.2.1.<domain>} resolves to the
 * sentinel address when {@code 1.2.3.4} is a listed exit. IPv4 only.
 * Only a missing name counts as "not listed"; timeouts and server failures are unknown.
 */
@Slf4j
public class TorDnsblReputationProvider implements ReputationProvider {

    public static final String NAME = "hostnameresolve";

    private final String domain;
    private final String sentinel;
    private final HostResolver resolver;

    public TorDnsblReputationProvider(String domain, String sentinel, Duration timeout) {
        this(domain, sentinel, dnsResolver(timeout));
    }

    public TorDnsblReputationProvider(String domain, String sentinel, HostResolver resolver) {
        this.domain = domain.startsWith(".") ? domain.substring(1) : domain;
        this.sentinel = sentinel;
        this.resolver = resolver;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ReputationKind kind() {
        return ReputationKind.TOR;
    }

    @Override
    public boolean supports(String ip) {
        return IpUtils.isIpv4(ip);
    }

    @Override
    public ProviderResult check(String ip) {
        String query = IpUtils.reverse(ip) + "." + domain;
        try {
            List<String> answers = resolver.resolve(query);
            if (answers.contains(sentinel)) {
                return new ProviderResult(Verdict.FLAGGED, Map.of("query", query, "answer", sentinel));
            }
            return ProviderResult.of(Verdict.CLEAN);
        } catch (NameNotFoundException ex) {
            return ProviderResult.of(Verdict.CLEAN);
        } catch (NamingException | RuntimeException ex) {
            log.warn("bot-guard tor dnsbl lookup failed for {}: {}", ip, ex.getMessage());
            return ProviderResult.unknown();
        }
    }

    @FunctionalInterface
    public interface HostResolver {
        /**
         * @return the A records of {@code host}
         * @throws NameNotFoundException when the name does not exist
         */
        List<String> resolve(String host) throws NamingException;
    }

    static HostResolver dnsResolver(Duration timeout) {
        Hashtable<String, String> env = new Hashtable<>();
        env.put(Context.INITIAL_CONTEXT_FACTORY, "com.sun.jndi.dns.DnsContextFactory");
        env.put("com.sun.jndi.dns.timeout.initial", String.valueOf(Math.max(1, timeout.toMillis())));
        env.put("com.sun.jndi.dns.timeout.retries", "1");
        return host -> {
            DirContext context = new InitialDirContext(env);
            try {
                Attribute records = context.getAttributes(host, new String[]{"A"}).get("A");
                List<String> answers = new ArrayList<>();
                if (records != null) {
                    NamingEnumeration<?> values = records.getAll();
                    while (values.hasMore()) {
                        answers.add(String.valueOf(values.next()));
                    }
                }
                return answers;
            } finally {
                context.close();
            }
        };
    }
}
