package com.khaounen.botguard.security.filters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.botguard.security.guard.GuardRequest;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link GuardRequest} backed by a servlet request. The JSON body is parsed
 * once from the cached bytes handed in by the filter.
 */
@Slf4j
class ServletGuardRequest implements GuardRequest {

    private final HttpServletRequest request;
    private final byte[] body;
    private final ObjectMapper objectMapper;

    private boolean jsonParsed;
    private Object json;

    ServletGuardRequest(HttpServletRequest request, byte[] body, ObjectMapper objectMapper) {
        this.request = request;
        this.body = body;
        this.objectMapper = objectMapper;
    }

    static boolean isJson(HttpServletRequest request) {
        String contentType = request.getContentType();
        return contentType != null && contentType.startsWith(MediaType.APPLICATION_JSON_VALUE);
    }

    @Override
    public String method() {
        return request.getMethod();
    }

    @Override
    public String path() {
        String uri = request.getRequestURI();
        return uri == null || uri.isEmpty() ? "/" : uri;
    }

    @Override
    public String host() {
        String host = request.getHeader("Host");
        if (host != null && !host.isBlank()) {
            return host.trim();
        }
        return request.getServerName();
    }

    @Override
    public boolean secure() {
        return request.isSecure();
    }

    @Override
    public Map<String, String> queryArgs() {
        Map<String, String[]> parameters = request.getParameterMap();
        if (parameters == null || parameters.isEmpty()) {
            return Map.of();
        }
        Map<String, String> args = new LinkedHashMap<>();
        parameters.forEach((name, values) -> {
            if (values != null && values.length > 0 && values[0] != null) {
                args.put(name, values[0]);
            }
        });
        return Collections.unmodifiableMap(args);
    }

    @Override
    public Object jsonBody() {
        if (!jsonParsed) {
            jsonParsed = true;
            json = parseJson();
        }
        return json;
    }

    private Object parseJson() {
        if (body == null || body.length == 0 || !isJson(request)) {
            return null;
        }
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (IOException ex) {
            log.debug("bot-guard ignoring unparsable JSON body: {}", ex.getMessage());
            return null;
        }
    }

    @Override
    public String header(String name) {
        return request.getHeader(name);
    }

    @Override
    public String remoteAddress() {
        return request.getRemoteAddr();
    }

    @Override
    public String protocol() {
        return request.getProtocol();
    }
}
