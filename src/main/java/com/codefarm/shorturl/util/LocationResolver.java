package com.codefarm.shorturl.util;

import com.codefarm.shorturl.model.Location;

/**
 * Classifies a requester address into a coarse country and city.
 */
public interface LocationResolver {

    /**
     * @param address raw client address, may be null
     * @return never null; {@link Location#UNKNOWN} when the address cannot be classified
     */
    Location resolve(String address);
}
