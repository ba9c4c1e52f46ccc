package com.olympicsdata.domain.model;

/**
 * One athlete code entered in one (discipline, event) of the incoming edition.
 */
public record ParticipationKey(String athleteCode, String discipline, String event) {
}
