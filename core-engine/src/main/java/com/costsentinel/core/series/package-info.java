/**
 * Series preparation: sorting, cost imputation, the insufficient-data check
 * and the descriptive statistics shared by the detectors.
 *
 * @since 1.0.0
 */
package com.costsentinel.core.series;
