package com.olympicsdata.domain.model;

/**
 * A (sport, event) pair contested at an edition.
 */
public record SportEvent(String sport, String event) {
}
