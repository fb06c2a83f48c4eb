package com.khaounen.botguard.security.guard;

import java.util.Map;

public interface GuardRequest {

    String method();

    String path();

    String host();

    boolean secure();

    Map<String, String> queryArgs();

    /**
     * @return the parsed JSON body (a map or a list), or {@code null} when the request carries none
     */
    Object jsonBody();

    String header(String name);

    String remoteAddress();

    String protocol();

    default String userAgent() {
        return header("User-Agent");
    }
}
