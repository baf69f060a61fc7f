package com.fitcycle.backend.auth.security;

import com.fitcycle.backend.auth.config.AdminProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.server.ResponseStatusException;

@Component
public class AuthContext {

    private final AdminProperties admin;

    public AuthContext(AdminProperties admin) {
        this.admin = admin;
    }

    public Long requireUserId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getPrincipal() instanceof Long l) {
            return l;
        }
        Object v = requestAttribute(TelegramInitDataFilter.ATTR_USER_ID);
        if (v instanceof Long l) return l;

        throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED");
    }

    public Long requireTgId() {
        Object v = requestAttribute(TelegramInitDataFilter.ATTR_TG_ID);
        if (v instanceof Long l) return l;
        throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED");
    }

    /** 回傳呼叫者的 userId；不在 app.admin.tg-ids 裡就 403 */
    public Long requireAdmin() {
        Long userId = requireUserId();
        if (!admin.isAdmin(requireTgId())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "ADMIN_REQUIRED");
        }
        return userId;
    }

    private static Object requestAttribute(String name) {
        var attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs == null) return null;
        HttpServletRequest req = attrs.getRequest();
        return req.getAttribute(name);
    }
}
