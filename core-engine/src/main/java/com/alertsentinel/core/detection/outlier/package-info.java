/**
 * Outlier-model detectors: isolation forest, k-nearest neighbours, ECOD and
 * COPOD. Registered only when the optional Smile library is present; see
 * {@link com.alertsentinel.core.detection.outlier.OutlierModelDetectors}.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.detection.outlier;
