/**
 * A thread-safe implementation of the <a href="https://en.wikipedia.org/wiki/Token_bucket">Token bucket
 * algorithm</a> over continuous time.
 * <p>
 * <b>Thread safety</b>: Classes are not thread-safe unless indicated otherwise (e.g.
 * {@link io.github.tokenrate.TokenBucket}).
 */
package io.github.tokenrate;
