/**
 * Hex, decimal, JSON string and data URI encoding helpers.
 */
package com.ryuqq.artledger.core.encoding;
