/**
 * Configuration for the cost anomaly engine.
 *
 * <p>
 * {@link com.costsentinel.core.config.DetectionConfig} holds the numeric
 * tuning parameters, resolved from the environment. The cloud billing
 * taxonomy (provider events, resource patterns, service categories and
 * mitigation advice) is defined in YAML and loaded by
 * {@link com.costsentinel.core.config.TaxonomyLoader} into a read-only
 * {@link com.costsentinel.core.config.CloudTaxonomy}. Validation runs right
 * after parsing so a broken taxonomy fails fast.
 * </p>
 *
 * @since 1.0.0
 */
package com.costsentinel.core.config;
