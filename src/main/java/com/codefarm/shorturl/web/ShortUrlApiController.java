package com.codefarm.shorturl.web;

import com.codefarm.shorturl.core.AliasService;
import com.codefarm.shorturl.web.dto.ShortenRequest;
import com.codefarm.shorturl.web.dto.ShortenResponse;
import com.codefarm.shorturl.web.dto.StatisticsResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequestMapping("/shorturls")
public class ShortUrlApiController {

    private final AliasService service;

    public ShortUrlApiController(AliasService service) {
        this.service = service;
    }

    @PostMapping
    public ResponseEntity<ShortenResponse> shorten(@RequestBody(required = false) ShortenRequest request,
                                                   HttpServletRequest httpRequest) {
        ShortenRequest body = request == null ? new ShortenRequest(null, null, null) : request;
        ShortenResponse response = service.createAlias(body.url(), body.validity(), body.shortcode(),
                requestBaseUrl(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{shortcode}")
    public ResponseEntity<StatisticsResponse> statistics(@PathVariable String shortcode) {
        return ResponseEntity.ok(service.getStatistics(shortcode));
    }

    /**
     * Scheme, host and port the client used, with default ports dropped. {@code X-Forwarded-*}
     * headers are already applied by the forwarded-header filter when running behind a proxy.
     */
    private static String requestBaseUrl(HttpServletRequest httpRequest) {
        return ServletUriComponentsBuilder.fromContextPath(httpRequest).build().toUriString();
    }
}
