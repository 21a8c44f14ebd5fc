/**
 * 최후 수단(Fallback) 어댑터.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.adapter.toolkit.fallback;
