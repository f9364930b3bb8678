/**
 * 컬렉션 설정.
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
package com.ryuqq.artledger.core.config;
