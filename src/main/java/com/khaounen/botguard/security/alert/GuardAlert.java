package com.khaounen.botguard.security.alert;

import com.khaounen.botguard.security.guard.Decision;
import com.khaounen.botguard.security.guard.DecisionReason;
import com.khaounen.botguard.security.guard.GuardAction;
import com.khaounen.botguard.security.guard.GuardContext;
import com.khaounen.botguard.utils.IpUtils;

import java.time.Instant;

public record GuardAlert(
        Instant timestamp,
        GuardAction action,
        DecisionReason reason,
        String beamId,
        String clientIp,
        String userAgent,
        String host,
        String method,
        String path
) {

    static GuardAlert of(Decision decision, GuardContext context, Instant now, boolean anonymizeIp) {
        String ip = context.clientIp();
        return new GuardAlert(
                now,
                decision.action(),
                decision.reason(),
                decision.beamId(),
                anonymizeIp ? IpUtils.anonymize(ip) : ip,
                context.userAgent(),
                context.request().host(),
                context.request().method(),
                context.request().path()
        );
    }

    String text() {
        return "action: " + action + '\n'
                + "reason: " + reason + '\n'
                + "time: " + timestamp + '\n'
                + "beam id: " + beamId + '\n'
                + "client: " + clientIp + '\n'
                + "user agent: " + userAgent + '\n'
                + "request: " + method + ' ' + host + path + '\n';
    }
}
