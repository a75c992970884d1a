package com.codefarm.shorturl.web;

import com.codefarm.shorturl.model.AliasRecord;
import com.codefarm.shorturl.repository.AliasStore;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = "shorturl.log-sink.enabled=false")
@AutoConfigureMockMvc
@Tag("integration")
public class ShortUrlApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AliasStore store;

    private void create(String body) throws Exception {
        mockMvc.perform(post("/shorturls").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated());
    }

    @Test
    void createsShortLinkWithCustomCode() throws Exception {
        mockMvc.perform(post("/shorturls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com/docs\",\"validity\":15,\"shortcode\":\"docs2026\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.shortLink").value("http://localhost/docs2026"))
                .andExpect(jsonPath("$.expiry").isString());
    }

    @Test
    void createsShortLinkWithGeneratedCode() throws Exception {
        mockMvc.perform(post("/shorturls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com/random\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.shortLink").value(matchesPattern("http://localhost/[a-zA-Z0-9]{6}")));
    }

    @Test
    void rejectsMissingUrl() throws Exception {
        mockMvc.perform(post("/shorturls").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("URL is required"))
                .andExpect(jsonPath("$.message").isString());
    }

    @Test
    void rejectsEmptyBody() throws Exception {
        mockMvc.perform(post("/shorturls").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("URL is required"));
    }

    @Test
    void rejectsUrlWithoutScheme() throws Exception {
        mockMvc.perform(post("/shorturls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"example.com\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid URL format"));
    }

    @Test
    void rejectsBadValidity() throws Exception {
        for (String validity : new String[]{"0", "-3", "1.5", "\"30\"", "true", "[30]"}) {
            mockMvc.perform(post("/shorturls")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"url\":\"https://example.com\",\"validity\":" + validity + "}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid validity period"));
        }
    }

    @Test
    void nullValidityFallsBackToDefault() throws Exception {
        Instant before = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        String body = mockMvc.perform(post("/shorturls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com\",\"validity\":null}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();

        Instant expiry = Instant.parse(JsonPath.read(body, "$.expiry"));
        assertFalse(expiry.isBefore(before.plus(Duration.ofMinutes(30))));
        assertTrue(expiry.isBefore(Instant.now().plus(Duration.ofMinutes(31))));
    }

    @Test
    void shortLinkUsesRequestHost() throws Exception {
        mockMvc.perform(post("/shorturls")
                        .header(HttpHeaders.HOST, "short.example:8443")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com\",\"shortcode\":\"hosted1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.shortLink").value("http://short.example:8443/hosted1"));
    }

    @Test
    void shortLinkHonoursForwardedHeaders() throws Exception {
        mockMvc.perform(post("/shorturls")
                        .header("X-Forwarded-Proto", "https")
                        .header("X-Forwarded-Host", "sho.rt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com\",\"shortcode\":\"proxied1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.shortLink").value("https://sho.rt/proxied1"));
    }

    @Test
    void crossOriginPreflightIsAllowed() throws Exception {
        mockMvc.perform(options("/shorturls")
                        .header(HttpHeaders.ORIGIN, "http://frontend.example")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "Content-Type"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*"))
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, containsString("POST")));

        create("{\"url\":\"https://example.com/cors\",\"shortcode\":\"cors01\"}");
        mockMvc.perform(get("/shorturls/cors01").header(HttpHeaders.ORIGIN, "http://frontend.example"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*"));
    }

    @Test
    void rejectsBadShortcodeFormat() throws Exception {
        mockMvc.perform(post("/shorturls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com\",\"shortcode\":\"ab\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid shortcode format"));
    }

    @Test
    void rejectsDuplicateShortcode() throws Exception {
        create("{\"url\":\"https://example.com/a\",\"shortcode\":\"dupe01\"}");

        mockMvc.perform(post("/shorturls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com/b\",\"shortcode\":\"dupe01\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Shortcode already exists"));
    }

    @Test
    void rejectsMalformedJson() throws Exception {
        mockMvc.perform(post("/shorturls").contentType(MediaType.APPLICATION_JSON).content("{\"url\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid request body"));
    }

    @Test
    void redirectsAndRecordsClick() throws Exception {
        create("{\"url\":\"https://example.com/landing\",\"shortcode\":\"landing1\"}");

        mockMvc.perform(get("/landing1")
                        .header(HttpHeaders.USER_AGENT, "JUnit")
                        .header(HttpHeaders.REFERER, "https://search.example.com/"))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, "https://example.com/landing"));

        mockMvc.perform(get("/shorturls/landing1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalClicks").value(1))
                .andExpect(jsonPath("$.originalUrl").value("https://example.com/landing"))
                .andExpect(jsonPath("$.creationDate").isString())
                .andExpect(jsonPath("$.expiryDate").isString())
                .andExpect(jsonPath("$.clickDetails.length()").value(1))
                .andExpect(jsonPath("$.clickDetails[0].userAgent").value("JUnit"))
                .andExpect(jsonPath("$.clickDetails[0].referer").value("https://search.example.com/"))
                .andExpect(jsonPath("$.clickDetails[0].location.country").value("Unknown"))
                .andExpect(jsonPath("$.clickDetails[0].location.city").value("Unknown"))
                .andExpect(jsonPath("$.clickDetails[0].timestamp").isString())
                .andExpect(jsonPath("$.clickDetails[0].requesterAddress").doesNotExist());
    }

    @Test
    void redirectWithoutHeadersUsesDefaults() throws Exception {
        create("{\"url\":\"https://example.com/plain\",\"shortcode\":\"plain01\"}");

        mockMvc.perform(get("/plain01").with(request -> {
                    request.setRemoteAddr("203.0.113.9");
                    return request;
                }))
                .andExpect(status().isFound());

        mockMvc.perform(get("/shorturls/plain01"))
                .andExpect(jsonPath("$.clickDetails[0].userAgent").value("Unknown"))
                .andExpect(jsonPath("$.clickDetails[0].referer").value("Direct"))
                .andExpect(jsonPath("$.clickDetails[0].location.country").isString());
    }

    @Test
    void expiredLinkIsGoneButStatisticsRemain() throws Exception {
        Instant created = Instant.now().minus(Duration.ofHours(2));
        store.insert(new AliasRecord("expired-id", "https://example.com/old", "oldlink1",
                created, created.plus(Duration.ofMinutes(30))));

        mockMvc.perform(get("/oldlink1"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.error").value("Short URL expired"));

        mockMvc.perform(get("/shorturls/oldlink1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalClicks").value(0))
                .andExpect(jsonPath("$.originalUrl").value("https://example.com/old"));
    }

    @Test
    void unknownAndMalformedCodes() throws Exception {
        mockMvc.perform(get("/nosuch99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Short URL not found"));
        mockMvc.perform(get("/ab"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid shortcode format"));
        mockMvc.perform(get("/shorturls/nosuch99"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/shorturls/a-b"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownRoutesReturnJsonNotFound() throws Exception {
        mockMvc.perform(get("/some/deep/path"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Route not found"))
                .andExpect(jsonPath("$.message").value(startsWith("The requested endpoint")));
        mockMvc.perform(delete("/shorturls"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Route not found"));
    }
}
