package com.fitcycle.backend.plan.sync;

import com.fitcycle.backend.plan.web.SheetFetchException;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SheetCsvClientTest {

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private static SheetCsvClient client() {
        // WireMock 對 h2c 不友善，固定 HTTP/1.1
        HttpClient jdk = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        RestClient rc = RestClient.builder()
                .baseUrl(wm.baseUrl())
                .requestFactory(new JdkClientHttpRequestFactory(jdk))
                .build();
        return new SheetCsvClient(rc);
    }

    @Test
    void fetches_csv_export_for_sheet_url_and_gid() {
        wm.stubFor(get(urlPathEqualTo("/spreadsheets/d/abc123/export"))
                .withQueryParam("format", equalTo("csv"))
                .withQueryParam("gid", equalTo("42"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "text/csv")
                        .withBody("workout_key\nA\nrest\n")));

        String body = client().fetchCsv("https://docs.google.com/spreadsheets/d/abc123/edit#gid=0", "42");

        assertThat(body).startsWith("workout_key");
        wm.verify(1, getRequestedFor(urlPathEqualTo("/spreadsheets/d/abc123/export")));
    }

    @Test
    void http_error_becomes_sheet_fetch_exception_with_status() {
        wm.stubFor(get(urlPathEqualTo("/spreadsheets/d/missing/export"))
                .willReturn(aResponse().withStatus(404).withBody("not found")));

        assertThatThrownBy(() -> client().fetchCsv("missing", "0"))
                .isInstanceOf(SheetFetchException.class)
                .satisfies(e -> {
                    SheetFetchException sfe = (SheetFetchException) e;
                    assertThat(sfe.getStatus()).isEqualTo(404);
                    assertThat(sfe.getMessage()).isEqualTo("SHEET_HTTP_404");
                    assertThat(sfe.getBodySnippet()).contains("not found");
                });
    }

    @Test
    void empty_body_is_rejected() {
        wm.stubFor(get(urlPathEqualTo("/spreadsheets/d/empty/export"))
                .willReturn(aResponse().withStatus(200).withBody("")));

        assertThatThrownBy(() -> client().fetchCsv("empty", "0"))
                .isInstanceOf(SheetFetchException.class)
                .hasMessage("SHEET_EMPTY_BODY");
    }

    @Test
    void csv_without_charset_is_decoded_as_utf8() {
        String csv = "\uFEFFworkout_key,level,name,sets,reps\nA,easy,Жим лёжа,3,10\n";
        wm.stubFor(get(urlPathEqualTo("/spreadsheets/d/ru/export"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "text/csv")
                        .withBody(csv.getBytes(StandardCharsets.UTF_8))));

        String body = client().fetchCsv("ru", "0");

        assertThat(body).startsWith("workout_key,");
        assertThat(body).contains("Жим лёжа");
    }

    @Test
    void declared_charset_is_respected() {
        Charset cp1251 = Charset.forName("windows-1251");
        wm.stubFor(get(urlPathEqualTo("/spreadsheets/d/cp/export"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "text/csv; charset=windows-1251")
                        .withBody("workout_key\nПрисед\n".getBytes(cp1251))));

        assertThat(client().fetchCsv("cp", "0")).contains("Присед");
    }
}
