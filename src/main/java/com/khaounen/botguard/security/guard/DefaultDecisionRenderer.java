package com.khaounen.botguard.security.guard;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

public class DefaultDecisionRenderer implements DecisionRenderer {

    @Override
    public void render(
            HttpServletRequest request,
            HttpServletResponse response,
            Decision decision
    ) throws IOException {
        response.setStatus(decision.httpStatus());
        response.setContentType("text/plain");
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(body(decision));
    }

    static String body(Decision decision) {
        StringBuilder sb = new StringBuilder();
        if (decision.action() == GuardAction.CHALLENGE) {
            sb.append("Verification required.\n");
        } else {
            sb.append("Access denied.\n");
        }
        Object beamId = decision.renderVariables().get("beam_id");
        if (beamId != null && !beamId.toString().isEmpty()) {
            sb.append("Beam ID: ").append(beamId).append('\n');
        }
        Object timestamp = decision.renderVariables().get("timestamp");
        if (timestamp != null) {
            sb.append("Time: ").append(timestamp).append('\n');
        }
        return sb.toString();
    }
}
