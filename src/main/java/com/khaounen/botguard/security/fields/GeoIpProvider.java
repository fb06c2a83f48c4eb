package com.khaounen.botguard.security.fields;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

public interface GeoIpProvider {

    Set<String> fields();

    /**
     * @return the attributes known for {@code ip}, or empty when the provider has no data
     */
    Optional<Map<String, Object>> lookup(String ip);
}
