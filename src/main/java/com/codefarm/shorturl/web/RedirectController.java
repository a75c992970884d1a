package com.codefarm.shorturl.web;

import com.codefarm.shorturl.core.AliasService;
import com.codefarm.shorturl.model.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RedirectController {

    private final AliasService service;

    public RedirectController(AliasService service) {
        this.service = service;
    }

    @GetMapping("/{shortcode}")
    public ResponseEntity<Void> redirect(@PathVariable String shortcode, HttpServletRequest request) {
        RequestContext context = new RequestContext(
                request.getHeader(HttpHeaders.USER_AGENT),
                request.getHeader(HttpHeaders.REFERER),
                request.getRemoteAddr());
        String target = service.resolve(shortcode, context);

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.LOCATION, target);
        // every hit has to reach the service to be counted
        headers.add(HttpHeaders.CACHE_CONTROL, "no-store");
        headers.add("X-Robots-Tag", "noindex");
        return new ResponseEntity<>(headers, HttpStatus.FOUND);
    }
}
