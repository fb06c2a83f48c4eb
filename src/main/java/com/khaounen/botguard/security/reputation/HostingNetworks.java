package com.khaounen.botguard.security.reputation;

import java.util.List;
import java.util.Locale;

/**
 * Operators of hosting, CDN and proxy networks. Browsers of real visitors rarely
 * originate from these, so an ISP or ASN name containing one is a strong bot signal.
 */
public final class HostingNetworks {

    public static final List<String> OPERATORS = List.of(
            "Fastly", "Incapsula", "Akamai", "AkamaiGslb", "Google", "Datacamp Limited",
            "Bing", "Censys", "Hetzner", "Linode", "Amazon", "AWS", "DigitalOcean", "Vultr",
            "Azure", "Alibaba", "Netlify", "IBM", "Oracle", "Scaleway", "Cloud"
    );

    private HostingNetworks() {
    }

    public static boolean matches(String organisation) {
        if (organisation == null || organisation.isBlank()) {
            return false;
        }
        String normalized = organisation.toLowerCase(Locale.ROOT);
        return OPERATORS.stream().anyMatch(op -> normalized.contains(op.toLowerCase(Locale.ROOT)));
    }
}
