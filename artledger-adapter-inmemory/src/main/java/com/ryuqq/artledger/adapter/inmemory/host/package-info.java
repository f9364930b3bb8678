/**
 * Simulated execution host capabilities: block entropy and code-bearing receivers.
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
package com.ryuqq.artledger.adapter.inmemory.host;
