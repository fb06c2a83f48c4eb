package com.khaounen.botguard.security.guard;

import java.util.Map;

public record Decision(
        GuardAction action,
        int httpStatus,
        DecisionReason reason,
        String beamId,
        Map<String, Object> renderVariables
) {

    public Decision {
        renderVariables = renderVariables == null ? Map.of() : Map.copyOf(renderVariables);
    }

    public static Decision of(GuardAction action, DecisionReason reason, String beamId, Map<String, Object> renderVariables) {
        return new Decision(action, action.httpStatus(), reason, beamId, renderVariables);
    }

    public boolean allowed() {
        return action == GuardAction.ALLOW;
    }
}
