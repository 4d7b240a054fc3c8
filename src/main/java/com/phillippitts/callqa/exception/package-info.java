/**
 * Application-specific exception hierarchy.
 *
 * <ul>
 *   <li>{@link com.phillippitts.callqa.exception.CallQaException} - base for all application errors</li>
 *   <li>{@link com.phillippitts.callqa.exception.EmbeddingException} - embedding provider failure
 *       during the optional pre-pass</li>
 * </ul>
 *
 * <p>The clustering core is total and throws none of these; only configuration validation
 * ({@link java.lang.IllegalArgumentException}) and the embedding pre-pass raise errors.
 */
package com.phillippitts.callqa.exception;
