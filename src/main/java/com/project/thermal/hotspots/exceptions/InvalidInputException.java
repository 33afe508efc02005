package com.project.thermal.hotspots.exceptions;

/**
 * Raised when a temperature grid is malformed: empty, ragged, or holding non-finite values.
 * Indicates an upstream contract violation, so the run is aborted.
 */
public class InvalidInputException extends HotspotDetectionException {
    public InvalidInputException(String message) { super(message); }
}
