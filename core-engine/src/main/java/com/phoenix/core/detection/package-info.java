/**
 * Baseline learning and deviation scoring.
 *
 * <ul>
 * <li>{@link com.phoenix.core.detection.BaselineLearner}: Welford running
 * mean/variance per signal</li>
 * <li>{@link com.phoenix.core.detection.DeviationDetector}: z-score
 * classification against a learned baseline</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.phoenix.core.detection;
