package com.fitcycle.backend.auth.security;

import com.fitcycle.backend.users.entity.User;
import com.fitcycle.backend.users.service.UserService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

@Slf4j
@Component
public class TelegramInitDataFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Tg-Init-Data";
    public static final String ATTR_USER_ID = "userId";
    public static final String ATTR_TG_ID = "tgId";

    private final TelegramInitDataVerifier verifier;
    private final UserService users;

    public TelegramInitDataFilter(TelegramInitDataVerifier verifier, UserService users) {
        this.verifier = verifier;
        this.users = users;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getRequestURI();
        return p.startsWith("/api/v1/health")
                || p.startsWith("/actuator")
                || p.startsWith("/v3/api-docs")
                || p.startsWith("/swagger-ui");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String initData = req.getHeader(HEADER);
        if (initData == null || initData.isBlank()) {
            chain.doFilter(req, res); // 沒帶就交給 EntryPoint 回 401
            return;
        }

        TelegramIdentity id;
        try {
            id = verifier.verify(initData);
        } catch (TelegramAuthException e) {
            log.debug("Init data rejected: {}", e.getMessage());
            unauthorized(res, e.getMessage());
            return;
        }

        User u = users.getOrCreate(id.tgId(), id.name(), null);

        // principal 只放 userId（Long）
        var authentication = new UsernamePasswordAuthenticationToken(u.getId(), null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        req.setAttribute(ATTR_USER_ID, u.getId());
        req.setAttribute(ATTR_TG_ID, u.getTgId());

        chain.doFilter(req, res);
    }

    private static void unauthorized(HttpServletResponse res, String code) throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        res.setContentType("application/json");
        res.getWriter().write("{\"code\":\"UNAUTHORIZED\",\"message\":\"" + code + "\"}");
    }
}
