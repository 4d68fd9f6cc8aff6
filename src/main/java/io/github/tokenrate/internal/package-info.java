/**
 * Implementation details that are not part of the public API.
 * <h1>Locking policy</h1>
 * <p>
 * Public methods acquire locks on behalf of the non-public methods that they invoke. A bucket owns exactly
 * one lock, so there is no lock ordering to respect.
 */
package io.github.tokenrate.internal;
