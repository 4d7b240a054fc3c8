/**
 * Optional embedding pre-pass and the immutable index the aggregator reads from.
 */
package com.phillippitts.callqa.service.embedding;
