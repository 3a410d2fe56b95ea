/**
 * Domain model of the cost anomaly engine.
 *
 * <p>
 * Inputs supplied by the caller:
 * </p>
 * <ul>
 * <li>{@link com.costsentinel.core.model.CostObservation} - one billed cost</li>
 * <li>{@link com.costsentinel.core.model.UtilizationObservation} - resource
 * usage side data</li>
 * <li>{@link com.costsentinel.core.model.CustomEvent} - caller-known events</li>
 * <li>{@link com.costsentinel.core.model.DetectionRequest} - the run
 * parameters</li>
 * </ul>
 * <p>
 * Outputs produced by the engine:
 * </p>
 * <ul>
 * <li>{@link com.costsentinel.core.model.AnomalyCandidate} and
 * {@link com.costsentinel.core.model.MethodResult} - per-method results</li>
 * <li>{@link com.costsentinel.core.model.AnomalyRecord} - a reconciled
 * anomaly, optionally carrying a
 * {@link com.costsentinel.core.model.RootCause} and a
 * {@link com.costsentinel.core.model.CloudContext}</li>
 * <li>{@link com.costsentinel.core.model.DetectionResult} - the response
 * envelope</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.costsentinel.core.model;
