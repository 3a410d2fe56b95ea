/**
 * JSON encoding of detection requests and results.
 *
 * @since 1.0.0
 */
package com.costsentinel.core.codec;
