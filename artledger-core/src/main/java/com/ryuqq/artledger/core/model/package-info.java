/**
 * Core domain model package containing value objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.artledger.core.model.Identity} - 20-byte participant identity (all-zero = null identity)</li>
 *   <li>{@link com.ryuqq.artledger.core.model.TokenId} - Sequential asset identifier starting at 1</li>
 *   <li>{@link com.ryuqq.artledger.core.model.EntropySnapshot} - Block hash and timestamp read from the host</li>
 *   <li>{@link com.ryuqq.artledger.core.model.Seed} - 256-bit hash seed</li>
 *   <li>{@link com.ryuqq.artledger.core.model.Attributes} - Two 24-bit colors and a {@link com.ryuqq.artledger.core.model.Shape}</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Byte arrays are copied on the way in and out</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ArtLedger Team
 */
package com.ryuqq.artledger.core.model;
