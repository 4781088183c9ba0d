/**
 * Pluggable anomaly detection engine.
 *
 * <p>
 * All detectors implement the
 * {@link com.alertsentinel.core.detection.Detector} interface and are
 * instantiated via {@link com.alertsentinel.core.detection.DetectorRegistry}.
 * Built-in detector types:
 * </p>
 * <ul>
 * <li>{@code threshold} — static lower/upper bounds</li>
 * <li>{@code zscore} — distance from the rolling mean in σ</li>
 * <li>{@code mad} — distance from the rolling median in scaled MADs</li>
 * <li>{@code iqr} — Tukey fences over the rolling window</li>
 * <li>{@code kmeans} — membership of the anomalous cluster</li>
 * <li>{@code ensemble} — flat AND/OR of two to five detectors</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a detector type, implement {@code Detector} and register a factory
 * for its type key with {@code DetectorRegistry.register()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.detection;
