package com.project.thermal.hotspots.exceptions;

/** Raised when a control parameter lies outside its valid domain. */
public class InvalidParameterException extends HotspotDetectionException {
    public InvalidParameterException(String message) { super(message); }
}
