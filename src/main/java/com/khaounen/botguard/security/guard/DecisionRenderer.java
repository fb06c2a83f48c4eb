package com.khaounen.botguard.security.guard;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * Writes the response for a request that was not allowed through.
 */
public interface DecisionRenderer {
    void render(HttpServletRequest request, HttpServletResponse response, Decision decision) throws IOException;
}
