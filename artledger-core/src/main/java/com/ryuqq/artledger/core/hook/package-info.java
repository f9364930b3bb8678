/**
 * Safe-transfer receipt confirmation and its sealed outcome types.
 *
 * @since 1.0.0
 * @author ArtLedger Team
 */
package com.ryuqq.artledger.core.hook;
