/**
 * Explanations for confirmed cost anomalies.
 *
 * <p>
 * {@link com.costsentinel.core.context.RootCauseAnalyzer} grades the spike
 * and lists typical causes for the service.
 * {@link com.costsentinel.core.context.CloudContextAnalyzer} classifies the
 * cost movement, matches it against provider billing events, utilization and
 * caller events, finds co-moving services and suggests mitigations. Both work
 * from the {@link com.costsentinel.core.context.ServiceHistory} of the batch
 * and the read-only {@link com.costsentinel.core.config.CloudTaxonomy}.
 * </p>
 *
 * @since 1.0.0
 */
package com.costsentinel.core.context;
