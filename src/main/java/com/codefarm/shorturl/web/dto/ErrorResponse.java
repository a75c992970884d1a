package com.codefarm.shorturl.web.dto;

public record ErrorResponse(String error, String message) {
}
