/**
 * Scriptable {@link com.ryuqq.artledger.core.spi.TokenReceiver} implementations for safe-transfer tests.
 *
 * @since 1.0.0
 * @author ArtLedger Team
 */
package com.ryuqq.artledger.testkit.receiver;
