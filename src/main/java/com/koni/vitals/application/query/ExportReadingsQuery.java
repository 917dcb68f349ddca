package com.koni.vitals.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for the full audit log of the last hours, normal readings included.
 */
@Getter
@AllArgsConstructor
public class ExportReadingsQuery {

    private final int hours;
}
