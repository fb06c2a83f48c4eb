package com.khaounen.botguard.security.guard;

import com.khaounen.botguard.security.fields.FieldMap;
import com.khaounen.botguard.security.fields.FieldResolver;
import com.khaounen.botguard.security.settings.GuardSettings;
import com.khaounen.botguard.security.settings.SettingsResolver;
import com.khaounen.botguard.utils.IpUtils;

/**
 * State of one evaluation. Client IP, Beam ID, fields and settings are each
 * computed on first access and reused for the rest of the request.
 */
public class GuardContext {

    private final GuardRequest request;
    private final FieldResolver fieldResolver;
    private final SettingsResolver settingsResolver;
    private final FingerprintStrategy fingerprintStrategy;

    private boolean ipResolved;
    private String clientIp;
    private String fingerprint;
    private FieldMap fields;
    private GuardSettings settings;

    public GuardContext(
            GuardRequest request,
            FieldResolver fieldResolver,
            SettingsResolver settingsResolver,
            FingerprintStrategy fingerprintStrategy
    ) {
        this.request = request;
        this.fieldResolver = fieldResolver;
        this.settingsResolver = settingsResolver;
        this.fingerprintStrategy = fingerprintStrategy;
    }

    public GuardRequest request() {
        return request;
    }

    public String userAgent() {
        return request.userAgent();
    }

    /**
     * @return the client address, or {@code null} when no usable public address was found
     */
    public String clientIp() {
        if (!ipResolved) {
            clientIp = IpUtils.resolveIp(request);
            ipResolved = true;
        }
        return clientIp;
    }

    public String fingerprint() {
        if (fingerprint == null) {
            fingerprint = fingerprintStrategy.generate(clientIp(), userAgent());
        }
        return fingerprint;
    }

    public FieldMap fields() {
        if (fields == null) {
            fields = fieldResolver.resolve(request, clientIp(), settingsResolver.defaults().getThirdParties());
        }
        return fields;
    }

    public GuardSettings settings() {
        if (settings == null) {
            settings = settingsResolver.resolve(fields());
        }
        return settings;
    }
}
