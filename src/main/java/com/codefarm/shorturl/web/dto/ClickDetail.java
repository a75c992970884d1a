package com.codefarm.shorturl.web.dto;

import com.codefarm.shorturl.model.ClickEvent;
import com.codefarm.shorturl.model.Location;

import java.time.Instant;

public record ClickDetail(Instant timestamp, String referer, String userAgent, Location location) {

    public static ClickDetail from(ClickEvent event) {
        return new ClickDetail(event.timestamp(), event.referer(), event.userAgent(), event.location());
    }
}
