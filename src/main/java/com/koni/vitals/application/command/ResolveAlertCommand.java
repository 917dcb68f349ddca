package com.koni.vitals.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to mark an alert as resolved.
 */
@Getter
@AllArgsConstructor
public class ResolveAlertCommand {

    private final Long alertId;
}
