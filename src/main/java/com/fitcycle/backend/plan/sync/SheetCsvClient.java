package com.fitcycle.backend.plan.sync;

import com.fitcycle.backend.plan.web.SheetFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * 下載 Google Sheet 某個分頁的 CSV 匯出。
 * 4xx/5xx、連線失敗、2xx 空 body 一律轉成 SheetFetchException，呼叫端不用分辨。
 */
@Slf4j
@Component
public class SheetCsvClient {

    private static final int MAX_ERROR_SNIPPET_BYTES = 512;

    private final RestClient http;

    public SheetCsvClient(@Qualifier("sheetRestClient") RestClient http) {
        this.http = http;
    }

    public String fetchCsv(String sheetId, String gid) {
        String id = SheetIds.extract(sheetId);
        String g = (gid == null || gid.isBlank()) ? "0" : gid.trim();

        ResponseEntity<byte[]> res;
        try {
            res = http.get()
                    .uri(b -> b.path("/spreadsheets/d/{id}/export")
                            .queryParam("format", "csv")
                            .queryParam("gid", g)
                            .build(id))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, errRes) -> {
                        int status = errRes.getStatusCode().value();
                        throw new SheetFetchException(status, "SHEET_HTTP_" + status, readBodySnippet(errRes));
                    })
                    .toEntity(byte[].class);
        } catch (ResourceAccessException e) {
            throw new SheetFetchException(0, "SHEET_UNREACHABLE", e.getMessage());
        }

        String body = decode(res);
        if (body == null || body.isBlank()) {
            throw new SheetFetchException(200, "SHEET_EMPTY_BODY", null);
        }
        log.debug("Sheet fetched: gid={}, bytes={}", g, body.length());
        return body;
    }

    /** Google 的 text/csv 常不帶 charset；沒寫就當 UTF-8 */
    static String decode(ResponseEntity<byte[]> res) {
        byte[] bytes = (res == null) ? null : res.getBody();
        if (bytes == null || bytes.length == 0) return null;

        Charset cs = StandardCharsets.UTF_8;
        MediaType type = res.getHeaders().getContentType();
        if (type != null && type.getCharset() != null) cs = type.getCharset();

        String s = new String(bytes, cs);
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }

    private static String readBodySnippet(ClientHttpResponse res) {
        try (InputStream in = res.getBody()) {
            byte[] bytes = in.readNBytes(MAX_ERROR_SNIPPET_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Sheet error body unreadable: {}", e.toString());
            return null;
        }
    }
}
