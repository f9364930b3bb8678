/**
 * In-memory event sink recording committed ledger notifications.
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
package com.ryuqq.artledger.adapter.inmemory.event;
