/**
 * Seeded isolation forest used by the isolation detection method.
 */
package com.costsentinel.core.detection.isolation;
