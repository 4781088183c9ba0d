package com.alertsentinel.core.model;

/**
 * Raised when a detector or detector tree is misconfigured.
 *
 * <p>
 * Thrown synchronously while building detectors so that a broken alert
 * surfaces to its owner instead of being reported as "no anomaly".
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfigException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public DetectorConfigException(String message) {
        super(message);
    }

    public DetectorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
