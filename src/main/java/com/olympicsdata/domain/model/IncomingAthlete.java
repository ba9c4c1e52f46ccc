package com.olympicsdata.domain.model;

import java.util.List;

/**
 * Athlete row of the incoming edition bundle, already normalized.
 *
 * @param code            bundle-local athlete code
 * @param displayName     title-cased full name
 * @param sex             as given by the bundle
 * @param born            normalized birth date
 * @param height          raw height
 * @param weight          raw weight
 * @param countryCode     NOC the athlete represented at the edition
 * @param countryName     display name of that NOC
 * @param nationalityCode NOC of nationality, may differ from the represented one
 * @param disciplines     disciplines entered
 * @param events          events entered
 */
public record IncomingAthlete(
    String code,
    String displayName,
    String sex,
    NormalizedDate born,
    String height,
    String weight,
    String countryCode,
    String countryName,
    String nationalityCode,
    List<String> disciplines,
    List<String> events
) {
}
