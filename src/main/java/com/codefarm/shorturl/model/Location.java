package com.codefarm.shorturl.model;

public record Location(String country, String city) {

    public static final Location UNKNOWN = new Location("Unknown", "Unknown");
}
