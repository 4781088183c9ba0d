/**
 * Value types shared by the detection engine and its callers.
 *
 * <ul>
 * <li>{@link com.alertsentinel.core.model.DetectionResult} — verdict of a
 * single detector</li>
 * <li>{@link com.alertsentinel.core.model.DetectorResult} — alert-level
 * verdict of a detector tree</li>
 * <li>{@link com.alertsentinel.core.model.DetectorConfig},
 * {@link com.alertsentinel.core.model.DetectorGroup} and
 * {@link com.alertsentinel.core.model.AlertDetectorsConfig} — the detector
 * tree of an alert</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.model;
