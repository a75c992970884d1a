package com.codefarm.shorturl.core;

import com.codefarm.shorturl.exception.ShortUrlException;
import com.codefarm.shorturl.exception.ShortcodeAllocationException;
import com.codefarm.shorturl.exception.ShortcodeConflictException;
import com.codefarm.shorturl.exception.ShortcodeExpiredException;
import com.codefarm.shorturl.exception.ShortcodeNotFoundException;
import com.codefarm.shorturl.exception.ValidationException;
import com.codefarm.shorturl.logging.LogSink;
import com.codefarm.shorturl.model.AliasRecord;
import com.codefarm.shorturl.model.AliasTarget;
import com.codefarm.shorturl.model.ClickEvent;
import com.codefarm.shorturl.model.Location;
import com.codefarm.shorturl.model.RequestContext;
import com.codefarm.shorturl.repository.AliasStore;
import com.codefarm.shorturl.util.LocationResolver;
import com.codefarm.shorturl.util.ShortcodeGenerator;
import com.codefarm.shorturl.util.UrlValidator;
import com.codefarm.shorturl.web.dto.ClickDetail;
import com.codefarm.shorturl.web.dto.ShortenResponse;
import com.codefarm.shorturl.web.dto.StatisticsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

@Service
public class AliasServiceImpl implements AliasService {

    private static final Logger log = LoggerFactory.getLogger(AliasServiceImpl.class);

    static final String SINK_STACK = "backend";
    static final String SINK_PACKAGE = "url_shortener";
    static final String DEFAULT_USER_AGENT = "Unknown";
    static final String DEFAULT_REFERER = "Direct";

    private static final BigDecimal MAX_VALIDITY = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final AliasStore store;
    private final ShortcodeGenerator generator;
    private final ExpiryPolicy expiryPolicy;
    private final LocationResolver locationResolver;
    private final LogSink logSink;
    private final Clock clock;
    private final int maxAttempts;
    private final String publicBaseUrl;

    public AliasServiceImpl(
            AliasStore store,
            ShortcodeGenerator generator,
            ExpiryPolicy expiryPolicy,
            LocationResolver locationResolver,
            LogSink logSink,
            Clock clock,
            @Value("${shorturl.shortcode.max-attempts:10}") int maxAttempts,
            @Value("${shorturl.public-base-url:}") String publicBaseUrl) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("max-attempts must be positive");
        }
        this.store = store;
        this.generator = generator;
        this.expiryPolicy = expiryPolicy;
        this.locationResolver = locationResolver;
        this.logSink = logSink;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.publicBaseUrl = publicBaseUrl == null ? "" : publicBaseUrl.trim();
    }

    @Override
    public ShortenResponse createAlias(String url, Number validityMinutes, String customCode, String requestBaseUrl) {
        sink("INFO", "Creating short URL for: " + (url == null ? "undefined" : url));
        try {
            ShortenResponse response = create(url, validityMinutes, customCode, requestBaseUrl);
            log.info("Created short link {} -> {}", response.shortLink(), url);
            sink("INFO", "Successfully created short URL: " + response.shortLink());
            return response;
        } catch (ShortUrlException ex) {
            log.debug("Rejected create request: {}", ex.getError());
            sink("ERROR", "Short URL creation failed (" + ex.getError() + ") for: " + url);
            throw ex;
        }
    }

    private ShortenResponse create(String url, Number validityMinutes, String customCode, String requestBaseUrl) {
        if (url == null || url.isEmpty()) {
            throw ValidationException.missingUrl();
        }
        if (!UrlValidator.isValidAbsoluteUrl(url)) {
            throw ValidationException.invalidUrl();
        }
        int validity = resolveValidity(validityMinutes);

        boolean custom = customCode != null && !customCode.isEmpty();
        if (custom && !generator.isValidFormat(customCode)) {
            throw ValidationException.invalidShortcodeFormat();
        }

        Instant now = now();
        Instant expiresAt = expiryPolicy.computeExpiry(now, validity);
        String shortcode = custom
                ? insertCustom(customCode, url, now, expiresAt)
                : insertGenerated(url, now, expiresAt);
        return new ShortenResponse(buildShortUrl(resolveBaseUrl(requestBaseUrl), shortcode), expiresAt);
    }

    private String insertCustom(String shortcode, String url, Instant now, Instant expiresAt) {
        if (store.contains(shortcode)) {
            throw new ShortcodeConflictException(shortcode);
        }
        // a concurrent create may still win between the check and the insert; insert throws then
        store.insert(newRecord(url, shortcode, now, expiresAt));
        return shortcode;
    }

    private String insertGenerated(String url, Instant now, Instant expiresAt) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String shortcode = generator.generate();
            if (store.contains(shortcode)) {
                log.debug("Generated short code {} already taken (attempt {})", shortcode, attempt);
                continue;
            }
            try {
                store.insert(newRecord(url, shortcode, now, expiresAt));
                return shortcode;
            } catch (ShortcodeConflictException ex) {
                log.debug("Lost insert race for short code {} (attempt {})", shortcode, attempt);
            }
        }
        log.error("Could not allocate a short code after {} attempts, store holds {} records",
                maxAttempts, store.size());
        throw new ShortcodeAllocationException(maxAttempts);
    }

    @Override
    public String resolve(String shortcode, RequestContext context) {
        try {
            if (!generator.isValidFormat(shortcode)) {
                throw ValidationException.invalidShortcodeFormat();
            }
            AliasTarget target = store.findTarget(shortcode)
                    .orElseThrow(() -> new ShortcodeNotFoundException(shortcode));

            Instant now = now();
            if (expiryPolicy.isExpired(now, target.expiresAt())) {
                throw new ShortcodeExpiredException(shortcode);
            }

            RequestContext ctx = context == null ? new RequestContext(null, null, null) : context;
            Location location = locationResolver.resolve(ctx.remoteAddress());
            ClickEvent event = new ClickEvent(now,
                    orDefault(ctx.referer(), DEFAULT_REFERER),
                    orDefault(ctx.userAgent(), DEFAULT_USER_AGENT),
                    ctx.remoteAddress(),
                    location);
            int clicks = store.recordClick(shortcode, event);

            sink("INFO", "Redirecting " + shortcode + " to " + target.originalUrl() + " - Click #" + clicks);
            return target.originalUrl();
        } catch (ShortUrlException ex) {
            sink("ERROR", "Redirect failed for " + shortcode + ": " + ex.getError());
            throw ex;
        }
    }

    @Override
    public StatisticsResponse getStatistics(String shortcode) {
        sink("INFO", "Retrieving statistics for shortcode: " + shortcode);
        try {
            if (!generator.isValidFormat(shortcode)) {
                throw ValidationException.invalidShortcodeFormat();
            }
            AliasRecord record = store.get(shortcode)
                    .orElseThrow(() -> new ShortcodeNotFoundException(shortcode));

            StatisticsResponse statistics = new StatisticsResponse(
                    record.getClickCount(),
                    record.getOriginalUrl(),
                    record.getCreatedAt(),
                    record.getExpiresAt(),
                    record.getClicks().stream().map(ClickDetail::from).toList());

            sink("INFO", "Statistics retrieved for " + shortcode + " - Total clicks: " + statistics.totalClicks());
            return statistics;
        } catch (ShortUrlException ex) {
            sink("ERROR", "Statistics request failed for " + shortcode + ": " + ex.getError());
            throw ex;
        }
    }

    private int resolveValidity(Number validityMinutes) {
        if (validityMinutes == null) {
            return expiryPolicy.defaultValidityMinutes();
        }
        BigDecimal minutes;
        try {
            minutes = new BigDecimal(validityMinutes.toString());
        } catch (NumberFormatException ex) {
            // NaN and infinities
            throw ValidationException.invalidValidity();
        }
        if (minutes.signum() <= 0
                || minutes.stripTrailingZeros().scale() > 0
                || minutes.compareTo(MAX_VALIDITY) > 0) {
            throw ValidationException.invalidValidity();
        }
        return minutes.intValueExact();
    }

    private AliasRecord newRecord(String url, String shortcode, Instant now, Instant expiresAt) {
        return new AliasRecord(UUID.randomUUID().toString(), url, shortcode, now, expiresAt);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private String resolveBaseUrl(String requestBaseUrl) {
        if (!publicBaseUrl.isEmpty()) {
            return publicBaseUrl;
        }
        return requestBaseUrl == null ? "" : requestBaseUrl;
    }

    private void sink(String level, String message) {
        logSink.log(SINK_STACK, level, SINK_PACKAGE, message);
    }

    private static String orDefault(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value;
    }

    private static String buildShortUrl(String baseUrl, String shortcode) {
        return StringUtils.trimTrailingCharacter(baseUrl, '/') + "/" + shortcode;
    }
}
