package com.fitcycle.backend.auth.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitcycle.backend.auth.config.TelegramProperties;
import com.fitcycle.backend.common.crypto.HmacSha256;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Telegram WebApp initData 驗證：
 * data_check_string = 除了 hash 以外的 key=value，依 key 排序、以 \n 串接
 * secret = SHA256(bot_token)，hash = hex(HMAC_SHA256(secret, data_check_string))
 */
@Component
public class TelegramInitDataVerifier {

    private final TelegramProperties props;
    private final ObjectMapper om;
    private final Clock clock;

    public TelegramInitDataVerifier(TelegramProperties props, ObjectMapper om, Clock clock) {
        this.props = props;
        this.om = om;
        this.clock = clock;
    }

    public TelegramIdentity verify(String initData) {
        if (initData == null || initData.isBlank()) throw new TelegramAuthException("INIT_DATA_REQUIRED");
        String token = props.getBotToken();
        if (token == null || token.isBlank()) throw new IllegalStateException("TELEGRAM_BOT_TOKEN_MISSING");

        Map<String, String> fields = parse(initData);
        String hash = fields.remove("hash");
        if (hash == null || hash.isBlank()) throw new TelegramAuthException("INIT_DATA_HASH_MISSING");

        String expected = HmacSha256.hex(HmacSha256.sha256(token), dataCheckString(fields));
        if (!HmacSha256.hexEquals(expected, hash)) throw new TelegramAuthException("INIT_DATA_SIGNATURE_INVALID");

        checkAge(fields.get("auth_date"));
        return identity(fields.get("user"));
    }

    static Map<String, String> parse(String initData) {
        Map<String, String> out = new TreeMap<>();
        for (String pair : initData.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String k = (eq < 0) ? pair : pair.substring(0, eq);
            String v = (eq < 0) ? "" : pair.substring(eq + 1);
            out.put(decode(k), decode(v));
        }
        return out;
    }

    /** fields 必須已經排序（TreeMap） */
    static String dataCheckString(Map<String, String> fields) {
        StringJoiner j = new StringJoiner("\n");
        fields.forEach((k, v) -> j.add(k + "=" + v));
        return j.toString();
    }

    private void checkAge(String authDate) {
        Duration maxAge = props.getInitDataMaxAge();
        if (maxAge == null || maxAge.isZero() || maxAge.isNegative()) return;

        if (authDate == null || authDate.isBlank()) throw new TelegramAuthException("INIT_DATA_AUTH_DATE_MISSING");
        long epoch;
        try {
            epoch = Long.parseLong(authDate.trim());
        } catch (NumberFormatException e) {
            throw new TelegramAuthException("INIT_DATA_AUTH_DATE_INVALID");
        }
        Instant signedAt = Instant.ofEpochSecond(epoch);
        if (signedAt.plus(maxAge).isBefore(clock.instant())) throw new TelegramAuthException("INIT_DATA_EXPIRED");
    }

    private TelegramIdentity identity(String userJson) {
        if (userJson == null || userJson.isBlank()) throw new TelegramAuthException("INIT_DATA_USER_MISSING");
        JsonNode user;
        try {
            user = om.readTree(userJson);
        } catch (JsonProcessingException e) {
            throw new TelegramAuthException("INIT_DATA_USER_INVALID");
        }
        JsonNode id = user.get("id");
        if (id == null || !id.canConvertToLong()) throw new TelegramAuthException("INIT_DATA_USER_INVALID");

        String name = text(user, "first_name");
        if (name == null) name = text(user, "username");
        return new TelegramIdentity(id.asLong(), name);
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
