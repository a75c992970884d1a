package com.codefarm.shorturl.util;

import com.codefarm.shorturl.model.Location;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Mock geolocation. Picks one of a fixed set of cities from the hash of the address string, so
 * the same address always lands on the same city. Not real geolocation.
 */
@Component
public class HashLocationResolver implements LocationResolver {

    static final List<Location> LOCATIONS = List.of(
            new Location("United States", "New York"),
            new Location("United Kingdom", "London"),
            new Location("Germany", "Berlin"),
            new Location("India", "Mumbai"),
            new Location("Canada", "Toronto"));

    private static final Set<String> UNRESOLVABLE = Set.of("Unknown", "::1", "0:0:0:0:0:0:0:1", "127.0.0.1");

    @Override
    public Location resolve(String address) {
        if (address == null || address.isEmpty() || UNRESOLVABLE.contains(address)) {
            return Location.UNKNOWN;
        }
        // widen before abs: Math.abs(Integer.MIN_VALUE) is still negative
        long hash = Math.abs((long) address.hashCode());
        return LOCATIONS.get((int) (hash % LOCATIONS.size()));
    }
}
