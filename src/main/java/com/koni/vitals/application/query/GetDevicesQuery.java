package com.koni.vitals.application.query;

/**
 * Query to retrieve every known device with its derived liveness.
 * It has no parameters; devices come back most recently seen first.
 */
public class GetDevicesQuery {
}
