package com.koni.vitals.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for unresolved alerts raised in the last hours.
 */
@Getter
@AllArgsConstructor
public class GetAlertsQuery {

    private final int hours;
}
