/**
 * Method slots, the z-score fallback policy and consensus reconciliation.
 *
 * <p>
 * {@link com.costsentinel.core.ensemble.MethodRunner} runs one slot and
 * substitutes z-score when the requested method cannot run.
 * {@link com.costsentinel.core.ensemble.EnsembleAggregator} runs one or more
 * slots, groups their candidates by date and service and keeps the groups a
 * majority of slots agree on.
 * </p>
 *
 * @since 1.0.0
 */
package com.costsentinel.core.ensemble;
