package com.codefarm.shorturl.core;

import com.codefarm.shorturl.model.RequestContext;
import com.codefarm.shorturl.web.dto.ShortenResponse;
import com.codefarm.shorturl.web.dto.StatisticsResponse;

public interface AliasService {

    /**
     * @param validityMinutes null for the default validity, otherwise a positive whole number
     * @param customCode      null or empty to generate a random code
     * @param requestBaseUrl  scheme, host and port the short link is built on
     */
    ShortenResponse createAlias(String url, Number validityMinutes, String customCode, String requestBaseUrl);

    /**
     * Records a click and returns the redirect target.
     */
    String resolve(String shortcode, RequestContext context);

    StatisticsResponse getStatistics(String shortcode);
}
