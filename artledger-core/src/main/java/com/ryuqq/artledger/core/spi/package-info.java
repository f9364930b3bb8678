/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the ports through which the ledger reaches its execution
 * host. Adapter modules provide the implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.artledger.core.spi.LedgerStore} - Atomic key-value ledger records with checkpoint/rollback</li>
 *   <li>{@link com.ryuqq.artledger.core.spi.EntropySource} - Block hash and timestamp snapshot</li>
 *   <li>{@link com.ryuqq.artledger.core.spi.EventSink} - Delivery of committed ledger notifications</li>
 *   <li>{@link com.ryuqq.artledger.core.spi.ReceiverDirectory} - Code-presence query and receiver lookup</li>
 *   <li>{@link com.ryuqq.artledger.core.spi.TokenReceiver} - Callback implemented by code-bearing recipients</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> The in-memory adapter is the reference implementation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ArtLedger Team
 */
package com.ryuqq.artledger.core.spi;
