package com.olympicsdata.domain.model;

/**
 * Medal awarded to one athlete in one event of the incoming edition.
 */
public record Medallist(String athleteCode, String discipline, String event, Medal medal) {

    public ParticipationKey participation() {
        return new ParticipationKey(athleteCode, discipline, event);
    }
}
