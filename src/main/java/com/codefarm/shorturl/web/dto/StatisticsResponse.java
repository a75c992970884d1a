package com.codefarm.shorturl.web.dto;

import java.time.Instant;
import java.util.List;

public record StatisticsResponse(int totalClicks,
                                 String originalUrl,
                                 Instant creationDate,
                                 Instant expiryDate,
                                 List<ClickDetail> clickDetails) {
}
