/**
 * 백엔드 구현을 위한 스레드 지원 유틸리티.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.support.MainThreadCall} - one-shot 결과 홀더</li>
 *   <li>{@link com.ryuqq.dispatcher.core.support.ProcessMainThread} - 프로세스 메인 스레드 식별</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.support;
