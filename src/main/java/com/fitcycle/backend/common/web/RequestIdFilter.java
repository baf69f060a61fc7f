package com.fitcycle.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final int MAX_LEN = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = sanitize(req.getHeader(HEADER));
        if (rid == null) rid = UUID.randomUUID().toString();

        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    public static String getOrCreate(HttpServletRequest req) {
        Object v = (req == null) ? null : req.getAttribute(ATTR);
        return (v == null) ? UUID.randomUUID().toString() : String.valueOf(v);
    }

    // client 帶進來的值會直接進 log，只收可見 ASCII
    private static String sanitize(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String t = raw.trim();
        if (t.length() > MAX_LEN) t = t.substring(0, MAX_LEN);
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c < 0x21 || c > 0x7e) return null;
        }
        return t;
    }
}
