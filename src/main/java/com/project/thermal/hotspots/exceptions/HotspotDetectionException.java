package com.project.thermal.hotspots.exceptions;

/** Domain-specific exception for hotspot detection errors. */
public class HotspotDetectionException extends RuntimeException {
    public HotspotDetectionException(String message) { super(message); }
    public HotspotDetectionException(String message, Throwable cause) { super(message, cause); }
}
