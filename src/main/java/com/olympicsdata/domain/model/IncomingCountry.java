package com.olympicsdata.domain.model;

/**
 * NOC row of the incoming edition bundle.
 */
public record IncomingCountry(String code, String name) {
}
