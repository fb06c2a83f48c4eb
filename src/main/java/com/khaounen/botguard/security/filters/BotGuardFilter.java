package com.khaounen.botguard.security.filters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.botguard.config.BotGuardProperties;
import com.khaounen.botguard.security.guard.Decision;
import com.khaounen.botguard.security.guard.DecisionEngine;
import com.khaounen.botguard.security.guard.DecisionRenderer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public class BotGuardFilter extends OncePerRequestFilter {

    public static final String BEAM_HEADER = "X-Bot-Guard-Beam";

    private final BotGuardProperties properties;
    private final DecisionEngine engine;
    private final ObjectMapper objectMapper;
    private final DecisionRenderer renderer;

    public BotGuardFilter(
            BotGuardProperties properties,
            DecisionEngine engine,
            ObjectMapper objectMapper,
            DecisionRenderer renderer
    ) {
        this.properties = properties;
        this.engine = engine;
        this.objectMapper = objectMapper;
        this.renderer = renderer;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        if (!properties.isEnabled()) {
            filterChain.doFilter(request, response);
            return;
        }

        HttpServletRequest effectiveRequest = request;
        byte[] body = null;
        if (ServletGuardRequest.isJson(request)) {
            body = StreamUtils.copyToByteArray(request.getInputStream());
            effectiveRequest = new CachedBodyRequest(request, body);
        }

        Decision decision = engine.evaluate(new ServletGuardRequest(effectiveRequest, body, objectMapper));
        if (decision.beamId() != null && !decision.beamId().isEmpty()) {
            response.setHeader(BEAM_HEADER, decision.beamId());
        }
        if (decision.allowed()) {
            filterChain.doFilter(effectiveRequest, response);
            return;
        }
        renderer.render(effectiveRequest, response, decision);
    }

    private static class CachedBodyRequest extends HttpServletRequestWrapper {
        private final byte[] body;

        private CachedBodyRequest(HttpServletRequest request, byte[] body) {
            super(request);
            this.body = body != null ? body : new byte[0];
        }

        @Override
        public ServletInputStream getInputStream() {
            return new ServletInputStream() {
                private int index = 0;

                @Override
                public boolean isFinished() {
                    return index >= body.length;
                }

                @Override
                public boolean isReady() {
                    return true;
                }

                @Override
                public void setReadListener(ReadListener readListener) {
                    throw new UnsupportedOperationException("async reads are not supported on a cached body");
                }

                @Override
                public int read() {
                    if (isFinished()) {
                        return -1;
                    }
                    return body[index++] & 0xff;
                }
            };
        }

        @Override
        public BufferedReader getReader() {
            return new BufferedReader(new InputStreamReader(getInputStream(), StandardCharsets.UTF_8));
        }
    }
}
