package com.khaounen.botguard.security.fields;

import java.util.Set;

/**
 * Names of the request fields rules can reference.
 */
public final class FieldNames {

    public static final String HOST = "host";
    public static final String NETLOC = "netloc";
    public static final String HOSTNAME = "hostname";
    public static final String DOMAIN = "domain";
    public static final String SUBDOMAIN = "subdomain";
    public static final String PATH = "path";
    public static final String METHOD = "method";
    public static final String SCHEME = "scheme";
    public static final String ARGS = "args";
    public static final String IS_JSON = "is_json";
    public static final String JSON = "json";
    public static final String URL = "url";
    public static final String IP = "ip";
    public static final String USER_AGENT = "user_agent";

    public static final String IS_IP_MALICIOUS = "is_ip_malicious";
    public static final String IS_IP_TOR = "is_ip_tor";

    public static final Set<String> REPUTATION = Set.of(IS_IP_MALICIOUS, IS_IP_TOR);

    private FieldNames() {
    }
}
